package mmpls.model.mm;

public enum StatementType {
	FLOATING_HYPOTHESIS("$f"),
	ESSENTIAL_HYPOTHESIS("$e"),
	AXIOM("$a"),
	THEOREM("$p");

	private final String keyword;

	StatementType(String keyword) {
		this.keyword = keyword;
	}

	public String getKeyword() {
		return keyword;
	}
}

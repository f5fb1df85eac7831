package mmpls.parsetrees;

public class MessageLog extends ParseTreesMessage {

	private final String text;

	public MessageLog(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(ParseTreesMessageVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return text.equals(((MessageLog) obj).text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public String toString() {
		return "MessageLog [text=" + text + "]";
	}
}

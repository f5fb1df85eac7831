package mmpls.model.parsetree;

import mmpls.lexer.MmToken;
import mmpls.lexer.MmTokenType;
import mmpls.util.SourceLocation;

import java.util.Objects;

public class LeafNode extends ParseTree {

	private final String value;
	private final MmTokenType tokenType;
	private final String kind;
	private final SourceLocation location;

	public LeafNode(String value, MmTokenType tokenType, String kind, SourceLocation location) {
		this.value = value;
		this.tokenType = tokenType;
		this.kind = kind;
		this.location = location;
	}

	public LeafNode(MmToken token) {
		this(token.getValue(), token.getType(), token.getKind(), token.getLocation());
	}

	public String getValue() {
		return value;
	}

	public MmTokenType getTokenType() {
		return tokenType;
	}

	public boolean isWorkingVar() {
		return tokenType == MmTokenType.WORKING_VARIABLE;
	}

	@Override
	public String getKind() {
		return kind;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(ParseTreeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, tokenType, kind, location);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		LeafNode other = (LeafNode) obj;
		return Objects.equals(value, other.value) && tokenType == other.tokenType &&
				Objects.equals(kind, other.kind) && Objects.equals(location, other.location);
	}
}

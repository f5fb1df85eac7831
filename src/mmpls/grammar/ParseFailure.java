package mmpls.grammar;

import mmpls.util.SourceLocation;

import java.util.Objects;

/**
 * Why a formula has no parse tree, and where the parser gave up.
 */
public class ParseFailure {

	public enum Reason {
		EMPTY_FORMULA,
		UNEXPECTED_TOKEN,
		UNEXPECTED_END_OF_FORMULA,
	}

	private final Reason reason;
	// null for EMPTY_FORMULA and UNEXPECTED_END_OF_FORMULA
	private final String token;
	private final SourceLocation location;

	public ParseFailure(Reason reason, String token, SourceLocation location) {
		this.reason = reason;
		this.token = token;
		this.location = location;
	}

	public Reason getReason() {
		return reason;
	}

	public String getToken() {
		return token;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String describe() {
		switch (reason) {
			case EMPTY_FORMULA:
				return "empty formula";
			case UNEXPECTED_TOKEN:
				return "unexpected token \"" + token + "\"";
			case UNEXPECTED_END_OF_FORMULA:
				return "unexpected end of formula";
			default:
				throw new IllegalStateException("unknown reason " + reason);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ParseFailure other = (ParseFailure) obj;
		return reason == other.reason && Objects.equals(token, other.token) &&
				Objects.equals(location, other.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(reason, token, location);
	}

	@Override
	public String toString() {
		return describe() + " " + location.prettyString();
	}
}

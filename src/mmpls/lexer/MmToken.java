package mmpls.lexer;

import mmpls.util.SourceLocatable;
import mmpls.util.SourceLocation;

public class MmToken extends SourceLocatable {

	private final String value;
	private final MmTokenType type;
	// null for constants
	private final String kind;
	private final SourceLocation location;

	public MmToken(String value, MmTokenType type, String kind, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.kind = kind;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public MmTokenType getType() {
		return type;
	}

	public String getKind() {
		return kind;
	}

	@Override
	public String toString() {
		return "MmToken [value=" + value + ", type=" + type + ", kind=" + kind + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((location == null) ? 0 : location.hashCode());
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((kind == null) ? 0 : kind.hashCode());
		result = prime * result + ((value == null) ? 0 : value.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		MmToken other = (MmToken) obj;
		if (location == null) {
			if (other.location != null)
				return false;
		} else if (!location.equals(other.location))
			return false;
		if (type != other.type)
			return false;
		if (kind == null) {
			if (other.kind != null)
				return false;
		} else if (!kind.equals(other.kind))
			return false;
		if (value == null) {
			return other.value == null;
		}
		return value.equals(other.value);
	}

}

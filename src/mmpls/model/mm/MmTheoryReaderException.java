package mmpls.model.mm;

import mmpls.MmplsException;
import mmpls.util.SourceLocation;

/**
 * Theory text that cannot be read at all, as opposed to a formula that does not parse.
 */
public class MmTheoryReaderException extends MmplsException {
	private static final long serialVersionUID = -6260218519475066301L;
	private static final String PREFIX = "Theory Error";

	private final SourceLocation location;

	public MmTheoryReaderException(String msg, SourceLocation location) {
		super(PREFIX, msg + " " + location.prettyString());
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}
}

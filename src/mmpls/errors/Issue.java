package mmpls.errors;

import mmpls.MmplsException;
import mmpls.formatters.IndentingWriter;
import mmpls.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends MmplsException {
	private static final String PREFIX = "Issue";

	public Issue() {
		super(PREFIX, "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new RuntimeException("string writers should not throw IO exceptions", e);
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}

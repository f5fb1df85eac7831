package mmpls.util;

/**
 * Anything that can be traced back to the text it was read from: tokens, parse tree leaves,
 * labeled statements and proof steps.
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}

package mmpls;

/**
 * Base of the exceptions raised by the language server core, consisting of a prefix
 * (kind of failure) and a message.
 *
 */
public abstract class MmplsException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public MmplsException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public MmplsException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}

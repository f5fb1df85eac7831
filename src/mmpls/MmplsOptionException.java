package mmpls;

public class MmplsOptionException extends Exception {
	private static final long serialVersionUID = 4211807301722963905L;

	public MmplsOptionException(String message) {
		super(message);
	}

	public MmplsOptionException(String message, Throwable cause) {
		super(message, cause);
	}
}

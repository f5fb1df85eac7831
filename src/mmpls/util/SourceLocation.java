package mmpls.util;

/**
 * A span of source text. Lines and columns are 0-based and the end column is exclusive, which is
 * the convention of LSP ranges. Offsets count characters from the start of the text the span was
 * lexed from (a formula, or a whole document).
 */
public class SourceLocation {
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(-1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startLine < 0;
	}

	public String prettyString() {
		if (isUnknown()) {
			return "at unknown source location";
		}
		if (startLine != endLine) {
			return "at " + (startLine + 1) + ":" + (startColumn + 1) + "-" + (endLine + 1) + ":" + endColumn;
		}
		if (startColumn != endColumn) {
			return "at " + (startLine + 1) + ":" + (startColumn + 1) + "-" + endColumn;
		}
		return "at " + (startLine + 1) + ":" + (startColumn + 1);
	}

	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		int mStartColumn, mEndColumn;
		if (startLine == other.getStartLine()) {
			mStartColumn = Integer.min(startColumn, other.getStartColumn());
		} else if (startLine < other.getStartLine()) {
			mStartColumn = startColumn;
		} else {
			mStartColumn = other.getStartColumn();
		}
		if (endLine == other.getEndLine()) {
			mEndColumn = Integer.max(endColumn, other.getEndColumn());
		} else if (endLine > other.getEndLine()) {
			mEndColumn = endColumn;
		} else {
			mEndColumn = other.getEndColumn();
		}
		return new SourceLocation(
				Integer.min(startOffset, other.startOffset),
				Integer.max(endOffset, other.endOffset),
				Integer.min(startLine, other.getStartLine()),
				Integer.max(endLine, other.getEndLine()),
				mStartColumn,
				mEndColumn);
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + endColumn;
		result = prime * result + endLine;
		result = prime * result + startOffset;
		result = prime * result + endOffset;
		result = prime * result + startColumn;
		result = prime * result + startLine;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine;
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [startOffset=" + startOffset + ", endOffset=" + endOffset +
				", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
				", endColumn=" + endColumn + "]";
	}

}

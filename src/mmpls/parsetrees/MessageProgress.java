package mmpls.parsetrees;

public class MessageProgress extends ParseTreesMessage {

	private final int index;
	private final int count;

	public MessageProgress(int index, int count) {
		this.index = index;
		this.count = count;
	}

	public int getIndex() {
		return index;
	}

	public int getCount() {
		return count;
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
		MessageProgress other = (MessageProgress) obj;
		return index == other.index && count == other.count;
	}

	@Override
	public int hashCode() {
		return 31 * index + count;
	}

	@Override
	public String toString() {
		return "MessageProgress [index=" + index + ", count=" + count + "]";
	}
}

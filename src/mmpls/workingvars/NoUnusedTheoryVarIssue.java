package mmpls.workingvars;

import mmpls.errors.Issue;
import mmpls.errors.IssueVisitor;
import mmpls.util.SourceLocation;

import java.util.Objects;

/**
 * One occurrence of a working variable that cannot be replaced, because every theory variable
 * of its kind is already used by the proof or taken by another working variable.
 */
public class NoUnusedTheoryVarIssue extends Issue {

	private final String workingVar;
	private final String kind;
	private final SourceLocation location;

	public NoUnusedTheoryVarIssue(String workingVar, String kind, SourceLocation location) {
		this.workingVar = workingVar;
		this.kind = kind;
		this.location = location;
	}

	public String getWorkingVar() {
		return workingVar;
	}

	public String getKind() {
		return kind;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		NoUnusedTheoryVarIssue other = (NoUnusedTheoryVarIssue) obj;
		return workingVar.equals(other.workingVar) && kind.equals(other.kind) && location.equals(other.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(workingVar, kind, location);
	}
}

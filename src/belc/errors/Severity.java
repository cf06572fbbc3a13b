package belc.errors;

public enum Severity {
	WARNING,
	ERROR
}

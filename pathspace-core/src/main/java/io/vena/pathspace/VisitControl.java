package io.vena.pathspace;

public enum VisitControl {
	CONTINUE,
	SKIP_CHILDREN,
	STOP,
}

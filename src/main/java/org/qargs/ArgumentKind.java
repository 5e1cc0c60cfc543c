package org.qargs;

/** The shape of a declared argument */
public enum ArgumentKind {
	/** A value-less argument whose presence alone is the signal, e.g. "--verbose" */
	FLAG("flag"),
	/** A named argument that takes one or more values, e.g. "--name value" */
	OPTION("option"),
	/** An argument identified by its position among the unnamed values */
	POSITIONAL("positional argument");

	/** How this kind is referred to in messages */
	public final String display;

	private ArgumentKind(String display) {
		this.display = display;
	}
}

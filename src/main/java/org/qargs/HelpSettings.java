package org.qargs;

import java.util.Objects;

/** Controls the layout of text produced by the {@link HelpWriter} */
public class HelpSettings {
	/** The width to which help is wrapped when nothing else is configured */
	public static final int DEFAULT_TERM_WIDTH = 120;

	/** Settings that wrap at {@link #DEFAULT_TERM_WIDTH} and annotate default and possible values */
	public static final HelpSettings DEFAULT = new HelpSettings(DEFAULT_TERM_WIDTH, true, true);

	private final int theTermWidth;
	private final boolean isShowingDefaults;
	private final boolean isShowingPossibleValues;

	/**
	 * @param termWidth The column at which help text is wrapped, or 0 to never wrap
	 * @param showDefaults Whether to annotate arguments with their "[default: x]" value
	 * @param showPossibleValues Whether to annotate arguments with their "[values: a, b]"
	 */
	public HelpSettings(int termWidth, boolean showDefaults, boolean showPossibleValues) {
		if (termWidth < 0)
			throw new IllegalArgumentException("Terminal width cannot be negative: " + termWidth);
		theTermWidth = termWidth == 0 ? Integer.MAX_VALUE : termWidth;
		isShowingDefaults = showDefaults;
		isShowingPossibleValues = showPossibleValues;
	}

	/** @return The column at which help text is wrapped */
	public int getTermWidth() {
		return theTermWidth;
	}

	/** @return Whether arguments are annotated with their default value */
	public boolean isShowingDefaults() {
		return isShowingDefaults;
	}

	/** @return Whether arguments are annotated with their possible values */
	public boolean isShowingPossibleValues() {
		return isShowingPossibleValues;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theTermWidth, isShowingDefaults, isShowingPossibleValues);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof HelpSettings))
			return false;
		HelpSettings other = (HelpSettings) obj;
		return theTermWidth == other.theTermWidth && isShowingDefaults == other.isShowingDefaults
			&& isShowingPossibleValues == other.isShowingPossibleValues;
	}

	@Override
	public String toString() {
		return "width=" + (theTermWidth == Integer.MAX_VALUE ? "unbounded" : String.valueOf(theTermWidth)) + ", defaults="
			+ isShowingDefaults + ", values=" + isShowingPossibleValues;
	}
}

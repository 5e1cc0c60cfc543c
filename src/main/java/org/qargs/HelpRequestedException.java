package org.qargs;

/**
 * Thrown by {@link ArgumentParser#parseOrThrow(CommandSpec, java.util.List)} if the command line asks for help instead of naming arguments
 */
public class HelpRequestedException extends Exception {
	private final CommandSpec theCommand;
	private final String theHelpText;

	/**
	 * @param command The command help was requested for
	 * @param helpText The rendered help for the command
	 */
	public HelpRequestedException(CommandSpec command, String helpText) {
		super("Help requested for " + command.getPath());
		theCommand = command;
		theHelpText = helpText;
	}

	/** @return The command help was requested for */
	public CommandSpec getCommand() {
		return theCommand;
	}

	/** @return The rendered help for the command */
	public String getHelpText() {
		return theHelpText;
	}
}

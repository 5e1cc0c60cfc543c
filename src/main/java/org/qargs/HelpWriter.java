package org.qargs;

import java.util.ArrayList;
import java.util.List;

/**
 * <p>
 * Renders the usage line and help text of a {@link CommandSpec}. Rendering reads only the command (and its parents, for the command path),
 * so the same command always renders the same text.
 * </p>
 * <p>
 * Unless the command declares a {@link CommandSpec#getHelpTemplate() template}, help is laid out as:
 *
 * <pre>
 * [before help]
 * {bin}
 * [author]
 * [about]
 *
 * USAGE:
 *     {usage}
 *
 * ARGS:
 *     &lt;FILE&gt;...    Input files
 *
 * OPTIONS:
 *     -n, --name &lt;NAME&gt;    The name [default: x]
 *
 * FLAGS:
 *     -h, --help    Prints help information
 *
 * SUBCOMMANDS:
 *     build    Builds things
 * [after help]
 * </pre>
 *
 * Empty sections are omitted, as are hidden arguments and subcommands.
 * </p>
 * <p>
 * A template is written as-is except for these tags, which are replaced with the corresponding piece of the default layout: {bin},
 * {about}, {author}, {usage}, {all-args} (all the sections with their headings), {positionals}, {options}, {flags}, {subcommands} (a single
 * section's entries without a heading), {before-help} and {after-help}. Unrecognized tags are written back unchanged.
 * </p>
 */
public class HelpWriter {
	/** The indentation of each entry in a help section */
	public static final String TAB = "    ";

	static final String HELP_DESCRIPTION = "Prints help information";
	static final String HELP_SUBCOMMAND_DESCRIPTION = "Prints this message or the help of the given subcommand(s)";

	private static class Entry {
		final String left;
		final String right;

		Entry(String left, String right) {
			this.left = left;
			this.right = right;
		}
	}

	private final CommandSpec theCommand;
	private final HelpSettings theSettings;
	private final StringBuilder theOutput;

	private HelpWriter(CommandSpec command, StringBuilder output) {
		theCommand = command;
		theSettings = command.getSettings().getHelp();
		theOutput = output;
	}

	/**
	 * @param command The command to render the usage of
	 * @return The command's usage line without a heading, e.g. "app build [FLAGS] [OPTIONS] --name &lt;NAME&gt; &lt;FILE&gt;..."
	 */
	public static String usage(CommandSpec command) {
		StringBuilder str = new StringBuilder(command.getPath());
		boolean flags = command.isShortHelpAvailable() || command.isLongHelpAvailable();
		boolean options = false;
		for (ArgumentSpec arg : command.getArguments()) {
			if (arg.isHidden())
				continue;
			else if (arg.isFlag())
				flags = true;
			else if (arg.isOption() && !arg.isRequired())
				options = true;
		}
		if (flags)
			str.append(" [FLAGS]");
		if (options)
			str.append(" [OPTIONS]");
		for (ArgumentSpec arg : command.getArguments()) {
			if (arg.isOption() && arg.isRequired()) {
				str.append(' ').append(arg.getLongName() != null ? "--" + arg.getLongName() : "-" + arg.getShortName());
				str.append(' ').append(arg.printValues());
			}
		}
		for (ArgumentSpec arg : command.getPositionals()) {
			if (arg.isRequired())
				str.append(' ').append(arg.printValues());
			else if (!arg.isHidden()) {
				str.append(" [").append(arg.getValueName()).append(']');
				if (arg.getMaxValues() > 1)
					str.append("...");
			}
		}
		if (hasVisibleSubcommands(command))
			str.append(command.getSettings().isSubcommandRequired() ? " <SUBCOMMAND>" : " [SUBCOMMAND]");
		return str.toString();
	}

	/**
	 * @param command The command to render the help of
	 * @return The command's help text
	 */
	public static String help(CommandSpec command) {
		HelpWriter writer = new HelpWriter(command, new StringBuilder());
		if (command.getHelpTemplate() != null)
			writer.writeTemplate(command.getHelpTemplate());
		else
			writer.writeDefault();
		return writer.theOutput.toString();
	}

	private static boolean hasVisibleSubcommands(CommandSpec command) {
		for (CommandSpec sub : command.getSubcommands().values()) {
			if (!sub.isHidden())
				return true;
		}
		return false;
	}

	private void writeDefault() {
		if (theCommand.getBeforeHelp() != null)
			writeText(theCommand.getBeforeHelp()).append("\n\n");
		theOutput.append(theCommand.getPath());
		if (theCommand.getAuthor() != null)
			writeText(theOutput.append('\n'), theCommand.getAuthor());
		if (theCommand.getAbout() != null)
			writeText(theOutput.append('\n'), theCommand.getAbout());
		theOutput.append("\n\nUSAGE:\n").append(TAB).append(usage(theCommand));
		int preArgs = theOutput.length();
		theOutput.append("\n\n");
		if (!writeAllArgs())
			theOutput.setLength(preArgs);
		if (theCommand.getAfterHelp() != null)
			writeText(theOutput.append("\n\n"), theCommand.getAfterHelp());
	}

	/** @return Whether any section was written */
	private boolean writeAllArgs() {
		boolean first = true;
		first = writeSection("ARGS", positionals(), first);
		first = writeSection("OPTIONS", options(), first);
		first = writeSection("FLAGS", flags(), first);
		first = writeSection("SUBCOMMANDS", subcommands(), first);
		return !first;
	}

	private boolean writeSection(String heading, List<Entry> entries, boolean first) {
		if (entries.isEmpty())
			return first;
		if (!first)
			theOutput.append("\n\n");
		theOutput.append(heading).append(":\n");
		writeEntries(entries);
		return false;
	}

	private void writeTemplate(String template) {
		int start = 0;
		while (start < template.length()) {
			int open = template.indexOf('{', start);
			int close = open < 0 ? -1 : template.indexOf('}', open + 1);
			if (close < 0) {
				theOutput.append(template, start, template.length());
				break;
			}
			theOutput.append(template, start, open);
			String tag = template.substring(open + 1, close);
			if (!writeTag(tag))
				theOutput.append('{').append(tag).append('}');
			start = close + 1;
		}
	}

	private boolean writeTag(String tag) {
		switch (tag) {
		case "bin":
			theOutput.append(theCommand.getPath());
			break;
		case "about":
			if (theCommand.getAbout() != null)
				writeText(theCommand.getAbout());
			break;
		case "author":
			if (theCommand.getAuthor() != null)
				writeText(theCommand.getAuthor());
			break;
		case "usage":
			theOutput.append(usage(theCommand));
			break;
		case "all-args":
			writeAllArgs();
			break;
		case "positionals":
			writeEntries(positionals());
			break;
		case "options":
			writeEntries(options());
			break;
		case "flags":
			writeEntries(flags());
			break;
		case "subcommands":
			writeEntries(subcommands());
			break;
		case "before-help":
			if (theCommand.getBeforeHelp() != null)
				writeText(theCommand.getBeforeHelp());
			break;
		case "after-help":
			if (theCommand.getAfterHelp() != null)
				writeText(theCommand.getAfterHelp());
			break;
		default:
			return false;
		}
		return true;
	}

	private List<Entry> positionals() {
		List<Entry> entries = new ArrayList<>();
		for (ArgumentSpec arg : theCommand.getPositionals()) {
			if (!arg.isHidden())
				entries.add(new Entry(arg.printValues(), describe(arg)));
		}
		return entries;
	}

	private List<Entry> options() {
		List<Entry> entries = new ArrayList<>();
		for (ArgumentSpec arg : theCommand.getArguments()) {
			if (arg.isOption() && !arg.isHidden())
				entries.add(new Entry(switchForm(arg.getShortName(), arg.getLongName(), arg.printValues()), describe(arg)));
		}
		return entries;
	}

	private List<Entry> flags() {
		List<Entry> entries = new ArrayList<>();
		for (ArgumentSpec arg : theCommand.getArguments()) {
			if (arg.isFlag() && !arg.isHidden())
				entries.add(new Entry(switchForm(arg.getShortName(), arg.getLongName(), ""), describe(arg)));
		}
		boolean shortHelp = theCommand.isShortHelpAvailable();
		boolean longHelp = theCommand.isLongHelpAvailable();
		if (shortHelp || longHelp)
			entries.add(new Entry(switchForm(shortHelp ? 'h' : null, longHelp ? "help" : null, ""), HELP_DESCRIPTION));
		return entries;
	}

	private List<Entry> subcommands() {
		List<Entry> entries = new ArrayList<>();
		for (CommandSpec sub : theCommand.getSubcommands().values()) {
			if (sub.isHidden())
				continue;
			StringBuilder descrip = new StringBuilder();
			if (sub.getAbout() != null)
				descrip.append(sub.getAbout());
			if (!sub.getVisibleAliases().isEmpty()) {
				if (descrip.length() > 0)
					descrip.append(' ');
				QargsUtils.print(descrip.append("[aliases: "), ", ", sub.getVisibleAliases(), null).append(']');
			}
			entries.add(new Entry(sub.getName(), descrip.toString()));
		}
		if (!entries.isEmpty() && theCommand.isHelpSubcommandAvailable())
			entries.add(new Entry("help", HELP_SUBCOMMAND_DESCRIPTION));
		return entries;
	}

	private static String switchForm(Character shortName, String longName, String values) {
		StringBuilder str = new StringBuilder();
		if (shortName != null) {
			str.append('-').append(shortName.charValue());
			if (longName != null)
				str.append(", ");
		} else
			str.append(TAB);
		if (longName != null)
			str.append("--").append(longName);
		if (!values.isEmpty())
			str.append(' ').append(values);
		return str.toString();
	}

	private String describe(ArgumentSpec arg) {
		StringBuilder str = new StringBuilder();
		if (arg.getDescription() != null)
			str.append(arg.getDescription());
		if (theSettings.isShowingDefaults() && arg.getDefaultValue() != null)
			annotate(str).append("[default: ").append(arg.getDefaultValue()).append(']');
		if (!arg.getVisibleAliases().isEmpty()) {
			QargsUtils.print(annotate(str).append("[aliases: "), ", ", arg.getVisibleAliases(), (alias, s) -> s.append("--").append(alias))
				.append(']');
		}
		if (theSettings.isShowingPossibleValues() && arg.getPossibleValues() != null)
			QargsUtils.print(annotate(str).append("[values: "), ", ", arg.getPossibleValues(), null).append(']');
		return str.toString();
	}

	private static StringBuilder annotate(StringBuilder str) {
		if (str.length() > 0)
			str.append(' ');
		return str;
	}

	private void writeEntries(List<Entry> entries) {
		// Short-less switches are padded so that long forms line up
		boolean anyShort = false;
		for (Entry entry : entries) {
			if (entry.left.startsWith("-") && !entry.left.startsWith("--"))
				anyShort = true;
		}
		int width = 0;
		for (Entry entry : entries)
			width = Math.max(width, left(entry, anyShort).length());
		int column = TAB.length() + width + TAB.length();
		int textWidth = Math.max(theSettings.getTermWidth() - column, 10);
		boolean first = true;
		for (Entry entry : entries) {
			if (!first)
				theOutput.append('\n');
			first = false;
			String left = left(entry, anyShort);
			theOutput.append(TAB).append(left);
			if (entry.right.isEmpty())
				continue;
			QargsUtils.spaces(theOutput, width - left.length() + TAB.length());
			boolean firstLine = true;
			for (String line : QargsUtils.wrap(entry.right, textWidth)) {
				if (!firstLine)
					QargsUtils.spaces(theOutput.append('\n'), column);
				firstLine = false;
				theOutput.append(line);
			}
		}
	}

	private static String left(Entry entry, boolean anyShort) {
		if (!anyShort && entry.left.startsWith(TAB))
			return entry.left.substring(TAB.length());
		return entry.left;
	}

	private StringBuilder writeText(String text) {
		return writeText(theOutput, text);
	}

	private StringBuilder writeText(StringBuilder into, String text) {
		List<String> lines = QargsUtils.wrap(text, theSettings.getTermWidth());
		for (int i = 0; i < lines.size(); i++) {
			if (i > 0)
				into.append('\n');
			into.append(lines.get(i));
		}
		return into;
	}
}

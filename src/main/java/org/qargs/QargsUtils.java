package org.qargs;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.BiConsumer;

/** Text utilities used for messages and help */
public class QargsUtils {
	private QargsUtils() {}

	/**
	 * Prints a sequence of values to a StringBuilder
	 *
	 * @param <T> The type of values to print
	 * @param into The StringBuilder to print into--may be null, in which case a new one will be created
	 * @param delimiter The character sequence to place between each value
	 * @param values The sequence to print
	 * @param format The formatter for the sequence, or null to append each value's string
	 * @return The printed StringBuilder
	 */
	public static <T> StringBuilder print(StringBuilder into, CharSequence delimiter, Iterable<? extends T> values,
		BiConsumer<? super T, ? super StringBuilder> format) {
		if (into == null)
			into = new StringBuilder();
		boolean first = true;
		for (T value : values) {
			if (first)
				first = false;
			else
				into.append(delimiter);
			if (format != null)
				format.accept(value, into);
			else
				into.append(value);
		}
		return into;
	}

	/**
	 * Prints a sequence like "v1, v2 or v3" or "v1 or v2"
	 *
	 * @param <T> The type of values to print
	 * @param into The StringBuilder to print into--may be null, in which case a new one will be created
	 * @param values The values to print
	 * @param conjunction The word to place before the last value, e.g. "or"
	 * @param format The formatter for the sequence, or null to append each value's string
	 * @return The printed StringBuilder
	 */
	public static <T> StringBuilder printConversational(StringBuilder into, Iterable<? extends T> values, String conjunction,
		BiConsumer<? super T, ? super StringBuilder> format) {
		if (into == null)
			into = new StringBuilder();
		Iterator<? extends T> iter = values.iterator();
		boolean first = true;
		while (iter.hasNext()) {
			T value = iter.next();
			if (!first)
				into.append(iter.hasNext() ? ", " : " " + conjunction + " ");
			first = false;
			if (format != null)
				format.accept(value, into);
			else
				into.append(value);
		}
		return into;
	}

	/**
	 * @param s1 The first string
	 * @param s2 The second string
	 * @return The number of single-character insertions, deletions and substitutions needed to turn one string into the other
	 */
	public static int editDistance(CharSequence s1, CharSequence s2) {
		int[] prev = new int[s2.length() + 1];
		int[] cur = new int[s2.length() + 1];
		for (int j = 0; j <= s2.length(); j++)
			prev[j] = j;
		for (int i = 1; i <= s1.length(); i++) {
			cur[0] = i;
			char c1 = s1.charAt(i - 1);
			for (int j = 1; j <= s2.length(); j++) {
				int cost = c1 == s2.charAt(j - 1) ? 0 : 1;
				cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
			}
			int[] tmp = prev;
			prev = cur;
			cur = tmp;
		}
		return prev[s2.length()];
	}

	/**
	 * Wraps text at word boundaries. Existing line breaks are kept. Words longer than the width are not broken.
	 *
	 * @param text The text to wrap
	 * @param width The maximum number of characters per line
	 * @return The lines of the wrapped text
	 */
	public static List<String> wrap(String text, int width) {
		List<String> lines = new ArrayList<>();
		for (String paragraph : text.split("\n", -1)) {
			if (paragraph.length() <= width) {
				lines.add(paragraph);
				continue;
			}
			StringBuilder line = new StringBuilder();
			for (String word : paragraph.split(" ")) {
				if (word.isEmpty())
					continue;
				if (line.length() > 0 && line.length() + 1 + word.length() > width) {
					lines.add(line.toString());
					line.setLength(0);
				}
				if (line.length() > 0)
					line.append(' ');
				line.append(word);
			}
			lines.add(line.toString());
		}
		return lines;
	}

	/**
	 * @param into The StringBuilder to append to
	 * @param count The number of spaces to append
	 * @return The StringBuilder
	 */
	public static StringBuilder spaces(StringBuilder into, int count) {
		for (int i = 0; i < count; i++)
			into.append(' ');
		return into;
	}
}

package org.qargs;

import java.util.List;

import com.google.common.collect.ImmutableList;

/** A declared relationship among a set of a command's arguments */
public class GroupSpec {
	/** The kinds of relationship a group may declare */
	public enum Kind {
		/** No two members may be present together */
		CONFLICT("conflict"),
		/** If the first member is present, every other member must be present as well */
		REQUIRES("requirement"),
		/** At least one member must be present */
		ONE_REQUIRED("one-required");

		/** How this kind is referred to in messages */
		public final String display;

		private Kind(String display) {
			this.display = display;
		}
	}

	private final String theName;
	private final Kind theKind;
	private final ImmutableList<String> theMembers;

	GroupSpec(String name, Kind kind, List<String> members) {
		theName = name;
		theKind = kind;
		theMembers = ImmutableList.copyOf(members);
	}

	/** @return The name of this group */
	public String getName() {
		return theName;
	}

	/** @return The relationship this group declares among its members */
	public Kind getKind() {
		return theKind;
	}

	/** @return The {@link ArgumentSpec#getName() names} of the arguments in this group, in declared order */
	public List<String> getMembers() {
		return theMembers;
	}

	/** @return For a {@link Kind#REQUIRES} group, the member whose presence requires the others. Otherwise null. */
	public String getTrigger() {
		return theKind == Kind.REQUIRES ? theMembers.get(0) : null;
	}

	/** @return For a {@link Kind#REQUIRES} group, the members required by the trigger. Otherwise all members. */
	public List<String> getRequired() {
		return theKind == Kind.REQUIRES ? theMembers.subList(1, theMembers.size()) : theMembers;
	}

	@Override
	public String toString() {
		return theName + " (" + theKind.display + ")" + theMembers;
	}
}

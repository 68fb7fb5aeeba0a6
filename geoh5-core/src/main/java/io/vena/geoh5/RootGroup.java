package io.vena.geoh5;

import java.util.UUID;

/**
 * The parentless group at the top of every {@link Workspace}.
 * It can't be removed.
 */
public final class RootGroup extends Group {
	public static final TypeIdentity TYPE_IDENTITY = TypeIdentity.of(
		UUID.fromString("dd99b610-be92-48c0-873c-5b5946ea2840"),
		"NoType",
		"<Unknown>");

	public static final EntityClass<GroupType, RootGroup> CLASS = new EntityClass<>(RootGroup.class, TYPE_IDENTITY, RootGroup::new);

	public static final String DEFAULT_NAME = "Workspace";

	RootGroup(Workspace workspace, UUID uid, String name, GroupType entityType) {
		super(workspace, uid, name, entityType);
	}
}

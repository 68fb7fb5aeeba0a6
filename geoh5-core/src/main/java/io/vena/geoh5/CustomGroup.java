package io.vena.geoh5;

import java.util.UUID;

/**
 * A group whose {@link GroupType} is made up at runtime
 * by {@link GroupType#createCustom}, or read from a store
 * that holds a group type this library doesn't know.
 *
 * @see Workspace#createCustomGroup
 */
public final class CustomGroup extends Group {
	public static final EntityClass<GroupType, CustomGroup> CLASS = new EntityClass<>(CustomGroup.class, TypeIdentity.unregistered("Custom"), CustomGroup::new);

	CustomGroup(Workspace workspace, UUID uid, String name, GroupType entityType) {
		super(workspace, uid, name, entityType);
	}
}

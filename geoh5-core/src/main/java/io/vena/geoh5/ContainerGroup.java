package io.vena.geoh5;

import java.util.UUID;
import org.jetbrains.annotations.Nullable;

/**
 * A plain folder of groups and objects.
 */
public final class ContainerGroup extends Group {
	public static final TypeIdentity TYPE_IDENTITY = TypeIdentity.of(
		UUID.fromString("61fbb4e8-a480-11e3-8d5a-2776bdf4f982"),
		"Container",
		"Container");

	public static final EntityClass<GroupType, ContainerGroup> CLASS = new EntityClass<>(ContainerGroup.class, TYPE_IDENTITY, ContainerGroup::new);

	ContainerGroup(Workspace workspace, UUID uid, String name, GroupType entityType) {
		super(workspace, uid, name, entityType);
	}

	public static ContainerGroup create(Workspace workspace, String name) {
		return create(workspace, name, null);
	}

	public static ContainerGroup create(Workspace workspace, String name, @Nullable Group parent) {
		return workspace.createGroup(CLASS, name, parent);
	}
}

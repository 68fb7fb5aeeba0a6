package io.vena.geoh5;

import java.util.UUID;

public abstract class Group extends Entity<GroupType> {
	protected Group(Workspace workspace, UUID uid, String name, GroupType entityType) {
		super(workspace, uid, name, entityType);
	}

	@Override
	public final EntityKind kind() {
		return EntityKind.GROUP;
	}
}

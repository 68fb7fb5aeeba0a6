package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.UUID;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

import static java.util.UUID.randomUUID;

/**
 * The {@link EntityType} of {@link Group}s. Besides identity, carries the
 * two content policies that viewers honour when users edit the group.
 */
public final class GroupType extends EntityType {
	private boolean allowMoveContent = true;
	private boolean allowDeleteContent = true;

	GroupType(Workspace workspace, UUID uid, @Nullable String name, @Nullable String description, @Nullable UUID classId) {
		super(workspace, uid, name, description, classId);
	}

	@Override
	public EntityKind kind() {
		return EntityKind.GROUP;
	}

	/**
	 * Finds or creates the type for the given group class.
	 * A workspace holds a single <code>GroupType</code> per concrete group class.
	 */
	public static GroupType findOrCreate(@NonNull Workspace workspace, @NonNull EntityClass<GroupType, ?> groupClass) {
		return findOrCreate(workspace, GroupType.class, groupClass.identity(), GroupType::new);
	}

	/**
	 * Creates a type for a group kind not known in advance, with a freshly generated uid
	 * that also serves as its class id.
	 */
	public static GroupType createCustom(@NonNull Workspace workspace, @Nullable String name, @Nullable String description) {
		UUID classId = randomUUID();
		GroupType result = new GroupType(workspace, classId, name, description, classId);
		workspace.registerType(result);
		return result;
	}

	public boolean allowMoveContent() {
		return allowMoveContent;
	}

	public void allowMoveContent(boolean allow) {
		allowMoveContent = allow;
		markModified();
	}

	public boolean allowDeleteContent() {
		return allowDeleteContent;
	}

	public void allowDeleteContent(boolean allow) {
		allowDeleteContent = allow;
		markModified();
	}

	@Override
	protected AttributeMap attributes() {
		return AttributeMap.empty()
			.with(ALLOW_MOVE_CONTENT, allowMoveContent)
			.with(ALLOW_DELETE_CONTENT, allowDeleteContent);
	}

	@Override
	protected void readAttributes(AttributeMap attributes) {
		allowMoveContent = attributes.bool(ALLOW_MOVE_CONTENT, true);
		allowDeleteContent = attributes.bool(ALLOW_DELETE_CONTENT, true);
	}

	private static final String ALLOW_MOVE_CONTENT = "Allow move contents";
	private static final String ALLOW_DELETE_CONTENT = "Allow delete contents";
}

package io.vena.geoh5;

import java.util.UUID;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

import static java.util.UUID.randomUUID;

public final class ObjectType extends EntityType {
	ObjectType(Workspace workspace, UUID uid, @Nullable String name, @Nullable String description, @Nullable UUID classId) {
		super(workspace, uid, name, description, classId);
	}

	@Override
	public EntityKind kind() {
		return EntityKind.OBJECT;
	}

	public static ObjectType findOrCreate(@NonNull Workspace workspace, @NonNull EntityClass<ObjectType, ?> objectClass) {
		return findOrCreate(workspace, ObjectType.class, objectClass.identity(), ObjectType::new);
	}

	public static ObjectType createCustom(@NonNull Workspace workspace, @Nullable String name, @Nullable String description) {
		UUID classId = randomUUID();
		ObjectType result = new ObjectType(workspace, classId, name, description, classId);
		workspace.registerType(result);
		return result;
	}
}

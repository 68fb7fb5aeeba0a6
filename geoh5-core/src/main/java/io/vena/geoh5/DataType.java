package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.UUID;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

import static java.util.UUID.randomUUID;

/**
 * The {@link EntityType} of {@link Data}.
 *
 * <p>
 * Unlike groups and objects, data types aren't tied to a Java class:
 * each new {@link Data} gets its own type unless an existing one is
 * explicitly shared with it when it is created.
 */
public final class DataType extends EntityType {
	private PrimitiveType primitiveType;

	DataType(Workspace workspace, UUID uid, @Nullable String name, @Nullable String description, @Nullable UUID classId) {
		this(workspace, uid, name, description, classId, PrimitiveType.UNKNOWN);
	}

	private DataType(Workspace workspace, UUID uid, @Nullable String name, @Nullable String description, @Nullable UUID classId, PrimitiveType primitiveType) {
		super(workspace, uid, name, description, classId);
		this.primitiveType = primitiveType;
	}

	@Override
	public EntityKind kind() {
		return EntityKind.DATA;
	}

	public PrimitiveType primitiveType() {
		return primitiveType;
	}

	/**
	 * Creates and registers a new data type with a freshly generated uid.
	 */
	public static DataType create(@NonNull Workspace workspace, @NonNull PrimitiveType primitiveType, @Nullable String name, @Nullable String description) {
		DataType result = new DataType(workspace, randomUUID(), name, description, null, primitiveType);
		workspace.registerType(result);
		return result;
	}

	@Override
	protected AttributeMap attributes() {
		return AttributeMap.empty().with(PRIMITIVE_TYPE, primitiveType);
	}

	@Override
	protected void readAttributes(AttributeMap attributes) {
		primitiveType = attributes.string(PRIMITIVE_TYPE)
			.map(PrimitiveType::valueOf)
			.orElse(PrimitiveType.UNKNOWN);
	}

	private static final String PRIMITIVE_TYPE = "Primitive type";
}

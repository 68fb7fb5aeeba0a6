package io.vena.geoh5.store;

import io.vena.geoh5.EntityKind;
import java.util.UUID;
import lombok.NonNull;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Persisted form of an {@link io.vena.geoh5.EntityType}.
 */
@Value
public class TypeRecord {
	@NonNull UUID uid;
	@NonNull EntityKind kind;
	@Nullable UUID classId;
	@Nullable String name;
	@Nullable String description;
	@NonNull AttributeMap attributes;
}

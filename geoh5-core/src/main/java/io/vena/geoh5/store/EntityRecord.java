package io.vena.geoh5.store;

import io.vena.geoh5.EntityKind;
import java.util.UUID;
import lombok.NonNull;
import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * Persisted form of an {@link io.vena.geoh5.Entity}, including its link to its parent.
 * Only the root group has a null {@link #parentUid}.
 */
@Value
public class EntityRecord {
	@NonNull UUID uid;
	@NonNull EntityKind kind;
	@NonNull UUID typeUid;
	@Nullable UUID parentUid;
	@NonNull String name;
	@NonNull AttributeMap attributes;
}

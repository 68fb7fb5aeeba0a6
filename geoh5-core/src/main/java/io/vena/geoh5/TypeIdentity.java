package io.vena.geoh5;

import java.util.UUID;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;

/**
 * The identity a concrete entity class declares for its {@link EntityType}:
 * a stable type uid, an optional class id, and display metadata.
 *
 * <p>
 * Classes whose types are created per instance, or made up at runtime,
 * declare a null {@link #typeUid}; such identities can't go through
 * {@link EntityType#findOrCreate find-or-create}.
 */
@Value
@With
public class TypeIdentity {
	@Nullable UUID typeUid;
	@Nullable UUID classId;
	String name;
	@Nullable String description;

	public static TypeIdentity of(UUID typeUid, String name, @Nullable String description) {
		return new TypeIdentity(typeUid, null, name, description);
	}

	public static TypeIdentity unregistered(String name) {
		return new TypeIdentity(null, null, name, null);
	}
}

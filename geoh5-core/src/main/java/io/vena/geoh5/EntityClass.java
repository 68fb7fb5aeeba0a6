package io.vena.geoh5;

import java.util.UUID;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Describes a concrete entity class to the {@link Workspace} factories:
 * the {@link TypeIdentity} its instances share, and how to construct one.
 *
 * @param <T> the family of {@link EntityType} the instances carry
 * @param <E> the concrete entity class
 */
@Getter
@RequiredArgsConstructor
public class EntityClass<T extends EntityType, E extends Entity<T>> {
	@NonNull private final Class<E> javaClass;
	@NonNull private final TypeIdentity identity;
	@NonNull private final EntityConstructor<T, E> constructor;

	@FunctionalInterface
	public interface EntityConstructor<T extends EntityType, E> {
		E construct(Workspace workspace, UUID uid, String name, T entityType);
	}

	@Override
	public String toString() {
		return "EntityClass(" + javaClass.getSimpleName() + ")";
	}
}

package io.vena.geoh5.store;

import io.vena.geoh5.OctreeCell;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.Value;

import static java.util.Collections.emptyList;
import static java.util.Collections.emptyMap;
import static java.util.Collections.emptySet;

/**
 * One batch of modifications to apply to a {@link ContainerStore}.
 * Upserted entities are ordered parents first.
 */
@Value
@Builder
public class ContainerChanges {
	@NonNull AttributeMap workspaceAttributes;
	@Default List<TypeRecord> types = emptyList();
	@Default List<EntityRecord> entities = emptyList();
	@Default Map<UUID, List<OctreeCell>> octreeCells = emptyMap();
	@Default Set<UUID> deletedEntities = emptySet();
	@Default Set<UUID> deletedTypes = emptySet();

	public boolean isEmpty() {
		return types.isEmpty()
			&& entities.isEmpty()
			&& octreeCells.isEmpty()
			&& deletedEntities.isEmpty()
			&& deletedTypes.isEmpty();
	}
}

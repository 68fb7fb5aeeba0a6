package io.vena.geoh5.store;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything a {@link ContainerStore} holds, except octree cells,
 * which are read separately and on demand.
 *
 * <p>
 * {@link #entities} are ordered so that every parent precedes its children.
 */
@Value
public class ContainerSnapshot {
	@NonNull AttributeMap workspaceAttributes;
	@NonNull List<TypeRecord> types;
	@NonNull List<EntityRecord> entities;
}

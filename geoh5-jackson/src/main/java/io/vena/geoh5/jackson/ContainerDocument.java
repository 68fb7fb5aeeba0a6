package io.vena.geoh5.jackson;

import io.vena.geoh5.OctreeCell;
import io.vena.geoh5.store.AttributeMap;
import io.vena.geoh5.store.EntityRecord;
import io.vena.geoh5.store.TypeRecord;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.NonNull;
import lombok.Value;

/**
 * The whole content of a JSON container file.
 */
@Value
public class ContainerDocument {
	@NonNull AttributeMap workspace;
	@NonNull List<TypeRecord> types;
	@NonNull List<EntityRecord> entities;
	@NonNull Map<UUID, List<OctreeCell>> octreeCells;
}

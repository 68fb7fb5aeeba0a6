package io.vena.geoh5.store;

import io.vena.geoh5.OctreeCell;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;

/**
 * A {@link ContainerStore} that keeps committed records in memory.
 *
 * <p>
 * Useful on its own for tests and scratch workspaces, and as the working state
 * of file-backed stores, which load into one of these and write it out after
 * each commit.
 */
public class MemoryContainerStore implements ContainerStore {
	private AttributeMap workspaceAttributes = AttributeMap.empty();
	private final Map<UUID, TypeRecord> types = new LinkedHashMap<>();
	private final Map<UUID, EntityRecord> entities = new LinkedHashMap<>();
	private final Map<UUID, List<OctreeCell>> octreeCells = new LinkedHashMap<>();
	private boolean committed = false;

	public MemoryContainerStore() { }

	/**
	 * Seeds the store with previously committed state.
	 */
	public MemoryContainerStore(ContainerSnapshot snapshot, Map<UUID, List<OctreeCell>> cells) {
		workspaceAttributes = snapshot.workspaceAttributes();
		snapshot.types().forEach(t -> types.put(t.uid(), t));
		snapshot.entities().forEach(e -> entities.put(e.uid(), e));
		cells.forEach((uid, list) -> octreeCells.put(uid, unmodifiableList(new ArrayList<>(list))));
		committed = true;
	}

	@Override
	public Optional<ContainerSnapshot> read() {
		if (committed) {
			return Optional.of(snapshot());
		} else {
			return Optional.empty();
		}
	}

	@Override
	public List<OctreeCell> fetchOctreeCells(UUID octreeUid) {
		return octreeCells.getOrDefault(octreeUid, emptyList());
	}

	@Override
	public void commit(ContainerChanges changes) {
		LOGGER.debug("Commit: {} types, {} entities, {} cell lists, {} entity deletions, {} type deletions",
			changes.types().size(),
			changes.entities().size(),
			changes.octreeCells().size(),
			changes.deletedEntities().size(),
			changes.deletedTypes().size());
		changes.deletedEntities().forEach(uid -> {
			entities.remove(uid);
			octreeCells.remove(uid);
		});
		changes.deletedTypes().forEach(types::remove);
		changes.types().forEach(t -> types.put(t.uid(), t));
		changes.entities().forEach(e -> entities.put(e.uid(), e));
		changes.octreeCells().forEach((uid, list) -> octreeCells.put(uid, unmodifiableList(new ArrayList<>(list))));
		workspaceAttributes = changes.workspaceAttributes();
		committed = true;
	}

	public ContainerSnapshot snapshot() {
		return new ContainerSnapshot(
			workspaceAttributes,
			unmodifiableList(new ArrayList<>(types.values())),
			unmodifiableList(new ArrayList<>(entities.values())));
	}

	public Map<UUID, List<OctreeCell>> allOctreeCells() {
		return new LinkedHashMap<>(octreeCells);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MemoryContainerStore.class);
}

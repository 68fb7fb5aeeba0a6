package io.vena.geoh5.store;

import io.vena.geoh5.EntityKind;
import io.vena.geoh5.OctreeCell;
import java.util.UUID;
import org.junit.jupiter.api.Test;

import static java.util.Arrays.asList;
import static java.util.Collections.singleton;
import static java.util.Collections.singletonList;
import static java.util.Collections.singletonMap;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryContainerStoreTest {
	final UUID typeUid = UUID.randomUUID();
	final UUID rootUid = UUID.randomUUID();
	final UUID octreeUid = UUID.randomUUID();

	@Test
	void read_beforeFirstCommit_isEmpty() {
		assertFalse(new MemoryContainerStore().read().isPresent());
	}

	@Test
	void commit_upsertsAndDeletes() {
		MemoryContainerStore store = new MemoryContainerStore();
		TypeRecord type = new TypeRecord(typeUid, EntityKind.GROUP, null, "NoType", null, AttributeMap.empty());
		EntityRecord root = new EntityRecord(rootUid, EntityKind.GROUP, typeUid, null, "Workspace", AttributeMap.empty());
		EntityRecord octree = new EntityRecord(octreeUid, EntityKind.OBJECT, typeUid, rootUid, "octree", AttributeMap.empty());
		store.commit(ContainerChanges.builder()
			.workspaceAttributes(AttributeMap.empty().with("Version", 1.0))
			.types(singletonList(type))
			.entities(asList(root, octree))
			.octreeCells(singletonMap(octreeUid, singletonList(new OctreeCell(0, 0, 0, 1))))
			.build());

		ContainerSnapshot snapshot = store.read().get();
		assertEquals(2, snapshot.entities().size());
		assertEquals(1.0, snapshot.workspaceAttributes().number("Version").get().doubleValue());
		assertEquals(1, store.fetchOctreeCells(octreeUid).size());

		EntityRecord renamed = new EntityRecord(rootUid, EntityKind.GROUP, typeUid, null, "Renamed", AttributeMap.empty());
		store.commit(ContainerChanges.builder()
			.workspaceAttributes(AttributeMap.empty())
			.entities(singletonList(renamed))
			.deletedEntities(singleton(octreeUid))
			.build());

		snapshot = store.read().get();
		assertEquals(singletonList(renamed), snapshot.entities());
		assertTrue(store.fetchOctreeCells(octreeUid).isEmpty());
		assertEquals(1, snapshot.types().size());
	}
}

package io.vena.geoh5;

import io.vena.geoh5.store.ContainerChanges;
import io.vena.geoh5.store.ContainerSnapshot;
import io.vena.geoh5.store.ContainerStore;
import io.vena.geoh5.store.EntityRecord;
import io.vena.geoh5.store.MemoryContainerStore;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.vecmath.Point3d;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.Arrays.asList;
import static java.util.Collections.singleton;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkspaceStoreTest {
	CountingStore store;

	@BeforeEach
	void setupStore() {
		store = new CountingStore(new MemoryContainerStore());
	}

	@Test
	void open_emptyStore_startsNewContainer() throws IOException {
		try (Workspace workspace = Workspace.open(store)) {
			assertEquals(1, workspace.groups().size());
			assertEquals(0, store.commits);
		}
		assertEquals(1, store.commits, "Close should save");
	}

	@Test
	void saveAndReopen_restoresEntityGraph() throws IOException {
		UUID groupUid, curveUid, dataUid;
		try (Workspace workspace = Workspace.open(store)) {
			ContainerGroup group = ContainerGroup.create(workspace, "group");
			group.entityType().allowDeleteContent(false);
			Curve curve = Curve.create(workspace, "curve", group);
			curve.vertices(new double[][] { { 0, 0, 0 }, { 1, 0, 0 }, { 1, 1, 0 } });
			FloatData data = curve.addFloatData("values", DataAssociation.VERTEX, new double[] { 1.5, 2.5, 3.5 }, null, "props");
			curve.addTextData("note", "hello");
			groupUid = group.uid();
			curveUid = curve.uid();
			dataUid = data.uid();
		}

		try (Workspace reopened = Workspace.open(store)) {
			assertEquals(2, reopened.groups().size());
			assertEquals(1, reopened.objects().size());
			assertEquals(2, reopened.data().size());

			Group group = reopened.findGroup(groupUid).get();
			assertInstanceOf(ContainerGroup.class, group);
			assertFalse(group.entityType().allowDeleteContent());
			assertEquals(reopened.root(), group.parent().get());

			Curve curve = (Curve) reopened.findObject(curveUid).get();
			assertEquals(group, curve.parent().get());
			assertEquals(2, curve.nCells());
			assertEquals(new Point3d(1, 1, 0), curve.vertices().get(2));
			assertThat(curve.findPropertyGroup("props").get().properties(), contains(dataUid));

			FloatData data = (FloatData) reopened.findData(dataUid).get();
			assertArrayEquals(new double[] { 1.5, 2.5, 3.5 }, data.values());
			assertEquals(DataAssociation.VERTEX, data.association());
			assertEquals(PrimitiveType.FLOAT, data.entityType().primitiveType());
			assertEquals("hello", ((TextData) curve.getData("note").get(0)).text());
			assertFalse(data.modified());
		}
	}

	@Test
	void save_writesOnlyModifiedEntities() throws IOException {
		try (Workspace workspace = Workspace.open(store)) {
			ContainerGroup.create(workspace, "first");
			workspace.save();
			Points points = Points.create(workspace, "points", null);
			workspace.save();
			List<UUID> written = store.lastChanges.entities().stream()
				.map(EntityRecord::uid)
				.collect(toList());
			assertEquals(asList(workspace.root().uid(), points.uid()), written);
			workspace.save();
			assertTrue(store.lastChanges.isEmpty());
		}
	}

	@Test
	void removedEntities_deletedFromStore() throws IOException {
		UUID keptUid;
		try (Workspace workspace = Workspace.open(store)) {
			ContainerGroup group = ContainerGroup.create(workspace, "group");
			Points kept = Points.create(workspace, "kept", group);
			Points removed = Points.create(workspace, "removed", group);
			removed.addFloatData("values", DataAssociation.OBJECT, new double[] { 1 });
			keptUid = kept.uid();
			workspace.save();

			workspace.removeEntity(removed);
			workspace.save();
			assertEquals(2, store.lastChanges.deletedEntities().size());
			assertEquals(1, store.lastChanges.deletedTypes().size());
		}
		try (Workspace reopened = Workspace.open(store)) {
			assertEquals(singleton(keptUid), reopened.objects().keySet());
			assertEquals(0, reopened.data().size());
			assertEquals(3, reopened.types().size());
		}
	}

	@Test
	void removeNeverSavedEntity_notSentAsDeletion() throws IOException {
		try (Workspace workspace = Workspace.open(store)) {
			Points points = Points.create(workspace, "points", null);
			workspace.removeEntity(points);
			workspace.save();
			assertTrue(store.lastChanges.deletedEntities().isEmpty());
		}
	}

	@Test
	void octreeCells_fetchedLazilyOnce() throws IOException {
		UUID octreeUid;
		try (Workspace workspace = Workspace.open(store)) {
			Octree octree = Octree.create(workspace, "octree")
				.uCount(8).vCount(4).wCount(4)
				.uCellSize(1).vCellSize(1).wCellSize(1);
			assertEquals(2, octree.nCells());
			octreeUid = octree.uid();
		}

		try (Workspace reopened = Workspace.open(store)) {
			Octree octree = reopened.findObject(octreeUid).flatMap(ObjectBase::asOctree).get();
			assertEquals(0, store.fetches);
			assertEquals(asList(new OctreeCell(0, 0, 0, 4), new OctreeCell(4, 0, 0, 4)), octree.octreeCells());
			assertEquals(1, store.fetches);
			octree.octreeCells();
			octree.centroids();
			assertEquals(1, store.fetches);
			assertEquals(Integer.valueOf(8), octree.uCount());
		}
	}

	@Test
	void closeWithoutSaveOnClose_discardsChanges() throws IOException {
		WorkspaceSettings settings = WorkspaceSettings.builder().saveOnClose(false).build();
		try (Workspace workspace = Workspace.open(store, settings)) {
			ContainerGroup.create(workspace, "unsaved");
		}
		assertEquals(0, store.commits);
		assertFalse(store.read().isPresent());
	}

	@Test
	void workspaceAttributes_roundTrip() throws IOException {
		WorkspaceSettings settings = WorkspaceSettings.builder()
			.version(2.0)
			.distanceUnit("feet")
			.contributors(asList("alice", "bob"))
			.build();
		try (Workspace workspace = Workspace.open(store, settings)) {
			workspace.save();
		}
		try (Workspace reopened = Workspace.open(store)) {
			assertEquals(2.0, reopened.version());
			assertEquals("feet", reopened.distanceUnit());
			assertEquals(asList("alice", "bob"), reopened.contributors());
		}
	}

	/**
	 * Counts calls so tests can check what the workspace asks of its store.
	 */
	static final class CountingStore implements ContainerStore {
		final ContainerStore downstream;
		int commits = 0;
		int fetches = 0;
		ContainerChanges lastChanges;

		CountingStore(ContainerStore downstream) {
			this.downstream = downstream;
		}

		@Override
		public Optional<ContainerSnapshot> read() throws IOException {
			return downstream.read();
		}

		@Override
		public List<OctreeCell> fetchOctreeCells(UUID octreeUid) throws IOException {
			fetches++;
			return downstream.fetchOctreeCells(octreeUid);
		}

		@Override
		public void commit(ContainerChanges changes) throws IOException {
			commits++;
			lastChanges = changes;
			downstream.commit(changes);
		}
	}
}

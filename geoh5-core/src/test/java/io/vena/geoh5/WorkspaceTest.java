package io.vena.geoh5;

import io.vena.geoh5.exceptions.InvalidTypeException;
import io.vena.geoh5.exceptions.MissingParentException;
import java.util.Random;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkspaceTest {
	Workspace workspace;
	final Random random = new Random(123);

	@BeforeEach
	void setupWorkspace() {
		workspace = new Workspace();
	}

	@Test
	void newWorkspace_hasOnlyRoot() {
		RootGroup root = workspace.root();
		assertEquals(RootGroup.DEFAULT_NAME, root.name());
		assertFalse(root.parent().isPresent());
		assertEquals(1, workspace.groups().size());
		assertEquals(1, workspace.types().size());
		assertSame(root, workspace.findGroup(root.uid()).get());
		assertEquals(RootGroup.TYPE_IDENTITY.typeUid(), root.entityType().uid());
	}

	@Test
	void create_nullParent_attachesToRoot() {
		ContainerGroup group = ContainerGroup.create(workspace, "group");
		assertSame(workspace.root(), group.parent().get());
		assertEquals(singletonList(group), workspace.root().children());
		assertSame(group, workspace.findEntity(group.uid()).get());
	}

	@Test
	void create_registersInMatchingCollection() {
		ContainerGroup group = ContainerGroup.create(workspace, "group");
		Curve curve = Curve.create(workspace, "curve", group);
		FloatData data = curve.addFloatData("values", DataAssociation.VERTEX, new double[] { 1, 2, 3 });

		assertSame(group, workspace.findGroup(group.uid()).get());
		assertSame(curve, workspace.findObject(curve.uid()).get());
		assertSame(data, workspace.findData(data.uid()).get());
		assertFalse(workspace.findGroup(curve.uid()).isPresent());
		assertFalse(workspace.findObject(data.uid()).isPresent());
		assertSame(curve, data.parent().get());
		assertSame(group, curve.parent().get());
	}

	@Test
	void findEntity_unknownUid_isEmpty() {
		assertFalse(workspace.findEntity(UUID.randomUUID()).isPresent());
	}

	@Test
	void getEntities_byName() {
		ContainerGroup first = ContainerGroup.create(workspace, "twin");
		Points second = Points.create(workspace, "twin", first);
		ContainerGroup.create(workspace, "other");
		assertEquals(asList(first, second), workspace.getEntities("twin"));
	}

	@Test
	void create_parentFromAnotherWorkspace_throws() {
		Workspace other = new Workspace();
		ContainerGroup foreign = ContainerGroup.create(other, "foreign");
		int typesBefore = workspace.types().size();
		assertThrows(MissingParentException.class, () -> Points.create(workspace, "points", foreign));
		assertEquals(typesBefore, workspace.types().size());
		assertEquals(0, workspace.objects().size());
	}

	@Test
	void create_removedParent_throws() {
		ContainerGroup group = ContainerGroup.create(workspace, "group");
		workspace.removeEntity(group);
		assertThrows(MissingParentException.class, () -> ContainerGroup.create(workspace, "child", group));
	}

	@Test
	void removeEntity_root_throws() {
		assertThrows(IllegalArgumentException.class, () -> workspace.removeEntity(workspace.root()));
	}

	@Test
	void removeEntity_isIdempotent() {
		Points points = Points.create(workspace, "points", null);
		workspace.removeEntity(points);
		workspace.removeEntity(points);
		assertEquals(0, workspace.objects().size());
		assertFalse(points.parent().isPresent());
		assertTrue(workspace.root().children().isEmpty());
	}

	@Test
	void removeEntity_cascadesAndRestoresCounts() {
		int groupsBefore = workspace.groups().size();
		int typesBefore = workspace.types().size();

		ContainerGroup group = ContainerGroup.create(workspace, "group");
		ContainerGroup nested = ContainerGroup.create(workspace, "nested", group);
		Curve curve = Curve.create(workspace, "curve", nested);
		curve.addFloatData("a", DataAssociation.VERTEX, new double[] { 1 });
		curve.addIntegerData("b", DataAssociation.VERTEX, new int[] { 1 });

		workspace.removeEntity(group);

		assertEquals(groupsBefore, workspace.groups().size());
		assertEquals(0, workspace.objects().size());
		assertEquals(0, workspace.data().size());
		assertEquals(typesBefore, workspace.types().size());
		assertFalse(workspace.findEntity(curve.uid()).isPresent());
	}

	@Test
	void removeEntity_keepsTypesStillInUse() {
		ContainerGroup a = ContainerGroup.create(workspace, "a");
		ContainerGroup b = ContainerGroup.create(workspace, "b");
		workspace.removeEntity(a);
		assertSame(b.entityType(), workspace.types().get(b.entityType().uid()));
		workspace.removeEntity(b);
		assertFalse(workspace.types().containsKey(b.entityType().uid()));
	}

	@Test
	void removeEntity_sharedDataTypesAndPropertyGroups() {
		double[][] xyz = randomVertices(12);
		ContainerGroup group = ContainerGroup.create(workspace, "group");
		Curve curve1 = Curve.create(workspace, "curve_1", group);
		curve1.vertices(xyz);
		curve1.addFloatData("DataValues", DataAssociation.VERTEX, randomValues(12));

		Curve curve2 = Curve.create(workspace, "curve_2", group);
		curve2.vertices(xyz);
		for (int i = 0; i < 4; i++) {
			DataType shared = (i == 0) ? ((Data) curve1.children().get(0)).entityType() : null;
			curve2.addFloatData("Period" + (i + 1), DataAssociation.VERTEX, randomValues(curve2.nVertices()), shared, "myGroup");
		}
		assertEquals(7, workspace.types().size());
		UUID removedFromGroup = curve2.children().get(1).uid();

		workspace.removeEntity(curve2.children().get(0));
		workspace.removeEntity(curve2.children().get(0));

		assertThat(curve2.findOrCreatePropertyGroup("myGroup").properties(), not(hasItem(removedFromGroup)));
		assertEquals(3, workspace.data().size());
		assertEquals(2, curve2.children().size());
		assertEquals(6, workspace.types().size());

		workspace.removeEntity(curve2);

		assertEquals(2, workspace.groups().size());
		assertEquals(1, workspace.objects().size());
		assertEquals(1, workspace.data().size());
		assertEquals(4, workspace.types().size());
	}

	@Test
	void removeData_purgesPropertyGroups() {
		Points points = Points.create(workspace, "points", null);
		FloatData a = points.addFloatData("a", DataAssociation.VERTEX, new double[] { 1 }, null, "group");
		FloatData b = points.addFloatData("b", DataAssociation.VERTEX, new double[] { 2 }, null, "group");
		PropertyGroup group = points.findPropertyGroup("group").get();
		assertThat(group.properties(), contains(a.uid(), b.uid()));
		assertEquals(DataAssociation.VERTEX, group.association());

		workspace.removeEntity(a);

		assertThat(group.properties(), contains(b.uid()));
		assertThat(points.dataNames(), contains("b"));
	}

	@Test
	void addDataToGroup_foreignData_throws() {
		Points first = Points.create(workspace, "first", null);
		Points second = Points.create(workspace, "second", null);
		FloatData data = first.addFloatData("a", DataAssociation.OBJECT, new double[] { 1 });
		assertThrows(IllegalArgumentException.class, () -> second.addDataToGroup(data, "group"));
	}

	@Test
	void createCustomGroup_registersNewType() {
		CustomGroup custom = workspace.createCustomGroup("Survey", "Field survey", "survey", null);
		assertSame(custom.entityType(), workspace.types().get(custom.entityType().uid()));
		assertEquals("Survey", custom.entityType().name());
		assertEquals(custom.entityType().uid(), custom.entityType().classId());
	}

	@Test
	void copyEntity_copiesSubtreeWithSameUids() {
		Workspace source = new Workspace();
		ContainerGroup group = ContainerGroup.create(source, "group");
		Curve curve = Curve.create(source, "curve", group);
		curve.vertices(randomVertices(3));
		FloatData data = curve.addFloatData("values", DataAssociation.VERTEX, new double[] { 1, 2, 3 }, null, "props");

		ContainerGroup copy = workspace.copyEntity(group, null);

		assertEquals(group.uid(), copy.uid());
		assertSame(workspace, copy.workspace());
		Curve curveCopy = (Curve) workspace.findObject(curve.uid()).get();
		assertEquals(curve.vertices(), curveCopy.vertices());
		FloatData dataCopy = (FloatData) workspace.findData(data.uid()).get();
		assertEquals(3, dataCopy.size());
		assertSame(curveCopy, dataCopy.parent().get());
		assertThat(curveCopy.findPropertyGroup("props").get().properties(), contains(data.uid()));
		assertSame(workspace, curveCopy.entityType().workspace());
		assertThrows(IllegalArgumentException.class, () -> workspace.copyEntity(group, null));
	}

	@Test
	void copyEntity_reusesExistingType() {
		ContainerGroup existing = ContainerGroup.create(workspace, "existing");
		Workspace source = new Workspace();
		ContainerGroup group = ContainerGroup.create(source, "group");
		ContainerGroup copy = workspace.copyEntity(group, null);
		assertSame(existing.entityType(), copy.entityType());
	}

	@Test
	void copyEntity_typeUidOfDifferentKind_throwsWithoutCopying() {
		Workspace source = new Workspace();
		ContainerGroup outer = ContainerGroup.create(source, "outer");
		CustomGroup inner = source.createCustomGroup("Clashing", null, "inner", outer);
		DataType clash = new DataType(workspace, inner.entityType().uid(), "clash", null, null);
		workspace.registerType(clash);
		int groupsBefore = workspace.groups().size();

		assertThrows(InvalidTypeException.class, () -> workspace.copyEntity(outer, null));

		assertEquals(groupsBefore, workspace.groups().size());
		assertFalse(workspace.findEntity(outer.uid()).isPresent());
		assertSame(clash, workspace.types().get(clash.uid()));
	}

	@Test
	void copyEntity_rootOrSameWorkspace_throws() {
		Workspace source = new Workspace();
		assertThrows(IllegalArgumentException.class, () -> workspace.copyEntity(source.root(), null));
		ContainerGroup mine = ContainerGroup.create(workspace, "mine");
		assertThrows(IllegalArgumentException.class, () -> workspace.copyEntity(mine, null));
	}

	@Test
	void closedWorkspace_rejectsCreation() throws Exception {
		workspace.close();
		assertTrue(workspace.isClosed());
		assertThrows(IllegalStateException.class, () -> ContainerGroup.create(workspace, "late"));
		workspace.close();
	}

	private double[][] randomVertices(int n) {
		double[][] result = new double[n][3];
		for (double[] row: result) {
			for (int c = 0; c < 3; c++) {
				row[c] = random.nextGaussian();
			}
		}
		return result;
	}

	private double[] randomValues(int n) {
		double[] result = new double[n];
		for (int i = 0; i < n; i++) {
			result[i] = random.nextGaussian();
		}
		return result;
	}
}

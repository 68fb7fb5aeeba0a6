package io.vena.geoh5;

import io.vena.geoh5.exceptions.InvalidTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityTypeTest {
	Workspace workspace;

	@BeforeEach
	void setupWorkspace() {
		workspace = new Workspace();
	}

	@Test
	void findOrCreate_sameClass_returnsSameInstance() {
		GroupType first = GroupType.findOrCreate(workspace, ContainerGroup.CLASS);
		GroupType second = GroupType.findOrCreate(workspace, ContainerGroup.CLASS);
		assertSame(first, second);
		assertSame(first, workspace.types().get(ContainerGroup.TYPE_IDENTITY.typeUid()));
	}

	@Test
	void findOrCreate_sharedByEntitiesOfSameClass() {
		ContainerGroup a = ContainerGroup.create(workspace, "a");
		ContainerGroup b = ContainerGroup.create(workspace, "b", a);
		assertSame(a.entityType(), b.entityType());
		assertEquals("Container", a.entityType().name());
	}

	@Test
	void findOrCreate_differentWorkspaces_differentInstances() {
		Workspace other = new Workspace();
		GroupType mine = GroupType.findOrCreate(workspace, ContainerGroup.CLASS);
		GroupType theirs = GroupType.findOrCreate(other, ContainerGroup.CLASS);
		assertNotSame(mine, theirs);
		assertEquals(mine.uid(), theirs.uid());
		assertSame(workspace, mine.workspace());
		assertSame(other, theirs.workspace());
	}

	@Test
	void findOrCreate_noTypeUid_throws() {
		InvalidTypeException e = assertThrows(InvalidTypeException.class, () ->
			GroupType.findOrCreate(workspace, CustomGroup.CLASS));
		assertThat(e.getMessage(), containsString("null UUID"));
	}

	@Test
	void classId_defaultsToUid() {
		ObjectType type = ObjectType.findOrCreate(workspace, Points.CLASS);
		assertFalse(type.hasExplicitClassId());
		assertEquals(type.uid(), type.classId());
	}

	@Test
	void createCustom_usesFreshUidAsClassId() {
		GroupType custom = GroupType.createCustom(workspace, "Survey", "Field survey");
		GroupType another = GroupType.createCustom(workspace, "Survey", "Field survey");
		assertTrue(custom.hasExplicitClassId());
		assertEquals(custom.uid(), custom.classId());
		assertNotEquals(custom.uid(), another.uid());
		assertSame(custom, workspace.findType(custom.uid(), GroupType.class).get());
	}

	@Test
	void findType_wrongClass_isEmpty() {
		GroupType groupType = GroupType.findOrCreate(workspace, ContainerGroup.CLASS);
		assertFalse(workspace.findType(groupType.uid(), ObjectType.class).isPresent());
		assertTrue(workspace.findType(groupType.uid(), EntityType.class).isPresent());
	}

	@Test
	void groupTypeFlags_markModified() {
		GroupType type = GroupType.findOrCreate(workspace, ContainerGroup.CLASS);
		type.markSaved();
		assertFalse(type.modified());
		assertTrue(type.allowMoveContent());
		type.allowMoveContent(false);
		assertFalse(type.allowMoveContent());
		assertTrue(type.modified());
	}

	@Test
	void dataType_createdPerData() {
		Points points = Points.create(workspace, "points", null);
		FloatData a = points.addFloatData("a", DataAssociation.OBJECT, new double[] { 1.0 });
		FloatData b = points.addFloatData("b", DataAssociation.OBJECT, new double[] { 2.0 });
		assertNotSame(a.entityType(), b.entityType());
		assertEquals(PrimitiveType.FLOAT, a.entityType().primitiveType());
		FloatData c = points.addFloatData("c", DataAssociation.OBJECT, new double[] { 3.0 }, a.entityType(), null);
		assertSame(a.entityType(), c.entityType());
	}

	@Test
	void sharedDataType_mismatchedPrimitiveType_throws() {
		Points points = Points.create(workspace, "points", null);
		FloatData a = points.addFloatData("a", DataAssociation.OBJECT, new double[] { 1.0 });
		assertThrows(IllegalArgumentException.class, () ->
			points.addIntegerData("b", DataAssociation.OBJECT, new int[] { 1 }, a.entityType(), null));
	}
}

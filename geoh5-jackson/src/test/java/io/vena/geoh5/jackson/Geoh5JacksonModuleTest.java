package io.vena.geoh5.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vena.geoh5.EntityKind;
import io.vena.geoh5.OctreeCell;
import io.vena.geoh5.store.AttributeMap;
import io.vena.geoh5.store.EntityRecord;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class Geoh5JacksonModuleTest {
	ObjectMapper mapper;

	@BeforeEach
	void setupMapper() {
		mapper = new ObjectMapper().registerModule(new Geoh5JacksonModule());
	}

	@Test
	void octreeCell_isFourIntegers() throws JsonProcessingException {
		assertEquals("[1,2,3,4]", mapper.writeValueAsString(new OctreeCell(1, 2, 3, 4)));
		assertEquals(new OctreeCell(5, 6, 7, 8), mapper.readValue("[5,6,7,8]", OctreeCell.class));
	}

	@Test
	void octreeCell_malformed_throws() {
		assertThrows(JsonProcessingException.class, () -> mapper.readValue("[1,2,3]", OctreeCell.class));
		assertThrows(JsonProcessingException.class, () -> mapper.readValue("[1,2,3,0]", OctreeCell.class));
		assertThrows(JsonProcessingException.class, () -> mapper.readValue("[1,2,3,\"x\"]", OctreeCell.class));
	}

	@Test
	void entityRecord_omitsNullParent() throws JsonProcessingException {
		UUID uid = UUID.randomUUID();
		UUID typeUid = UUID.randomUUID();
		EntityRecord root = new EntityRecord(uid, EntityKind.GROUP, typeUid, null, "Workspace",
			AttributeMap.empty().with("Values", new double[] { 1.5, 2.5 }));
		String json = mapper.writeValueAsString(root);
		assertEquals("{\"uid\":\"" + uid + "\",\"kind\":\"GROUP\",\"type\":\"" + typeUid + "\",\"name\":\"Workspace\",\"attributes\":{\"Values\":[1.5,2.5]}}", json);

		EntityRecord read = mapper.readValue(json, EntityRecord.class);
		assertNull(read.parentUid());
		assertEquals(typeUid, read.typeUid());
		assertArrayEquals(new double[] { 1.5, 2.5 }, read.attributes().doubles("Values").get());
	}

	@Test
	void entityRecord_missingField_throws() {
		assertThrows(JsonProcessingException.class, () ->
			mapper.readValue("{\"uid\":\"" + UUID.randomUUID() + "\",\"kind\":\"GROUP\",\"name\":\"x\"}", EntityRecord.class));
		assertThrows(JsonProcessingException.class, () ->
			mapper.readValue("{\"uid\":\"not-a-uid\",\"kind\":\"GROUP\",\"type\":\"" + UUID.randomUUID() + "\",\"name\":\"x\"}", EntityRecord.class));
	}

	@Test
	void attributeMap_keepsOrder() throws JsonProcessingException {
		AttributeMap map = AttributeMap.empty().with("z", 1).with("a", "two").with("m", true);
		String json = mapper.writeValueAsString(map);
		assertEquals("{\"z\":1,\"a\":\"two\",\"m\":true}", json);
		assertEquals(map, mapper.readValue(json, AttributeMap.class));
	}
}

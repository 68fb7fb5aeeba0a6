package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.UUID;
import lombok.NonNull;

public final class IntegerData extends Data {
	public static final DataClass<IntegerData> CLASS = new DataClass<>(IntegerData.class, PrimitiveType.INTEGER, IntegerData::new);

	private int[] values = new int[0];

	IntegerData(Workspace workspace, UUID uid, String name, DataType entityType) {
		super(workspace, uid, name, entityType);
	}

	@Override
	public PrimitiveType primitiveType() {
		return PrimitiveType.INTEGER;
	}

	public int[] values() {
		return values.clone();
	}

	public void values(@NonNull int[] newValues) {
		values = newValues.clone();
		markModified();
	}

	public int size() {
		return values.length;
	}

	@Override
	protected AttributeMap attributes() {
		return super.attributes().with(VALUES, values);
	}

	@Override
	protected void readAttributes(AttributeMap attributes) {
		super.readAttributes(attributes);
		values = attributes.ints(VALUES).orElse(new int[0]);
	}
}

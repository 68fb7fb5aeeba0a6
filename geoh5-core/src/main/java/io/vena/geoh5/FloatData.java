package io.vena.geoh5;

import io.vena.geoh5.store.AttributeMap;
import java.util.UUID;
import lombok.NonNull;

public final class FloatData extends Data {
	public static final DataClass<FloatData> CLASS = new DataClass<>(FloatData.class, PrimitiveType.FLOAT, FloatData::new);

	private double[] values = new double[0];

	FloatData(Workspace workspace, UUID uid, String name, DataType entityType) {
		super(workspace, uid, name, entityType);
	}

	@Override
	public PrimitiveType primitiveType() {
		return PrimitiveType.FLOAT;
	}

	public double[] values() {
		return values.clone();
	}

	public void values(@NonNull double[] newValues) {
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
		values = attributes.doubles(VALUES).orElse(new double[0]);
	}
}

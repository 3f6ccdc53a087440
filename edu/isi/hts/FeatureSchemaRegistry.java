package edu.isi.hts;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Named feature schemas known to one clustering run. The triphone and mono
 * schemas are always present.
 */
public class FeatureSchemaRegistry {
	private final Map<String, FeatureSchema> schemas = new HashMap<String, FeatureSchema>();

	public FeatureSchemaRegistry() {
		schemas.put(FeatureSchema.TRIPHONE.getName(), FeatureSchema.TRIPHONE);
		schemas.put(FeatureSchema.MONOPHONE.getName(), FeatureSchema.MONOPHONE);
	}

	/** create and register a schema over the default separators */
	public FeatureSchema create(String name, List<String> features)
		throws StructuralInvariantException, ConflictException {
		return create(name, features, FeatureSchema.DEFAULT_SEPARATORS);
	}

	public FeatureSchema create(String name, List<String> features, String separators)
		throws StructuralInvariantException, ConflictException {
		if (schemas.containsKey(name))
			throw new ConflictException("Feature schema "+name+" already exists");
		FeatureSchema schema = FeatureSchema.create(name, features, separators);
		schemas.put(name, schema);
		return schema;
	}

	public boolean contains(String name) {
		return schemas.containsKey(name);
	}

	public FeatureSchema get(String name) throws UndefinedReferenceException {
		FeatureSchema schema = schemas.get(name);
		if (schema == null)
			throw new UndefinedReferenceException("No feature schema named "+name);
		return schema;
	}
}

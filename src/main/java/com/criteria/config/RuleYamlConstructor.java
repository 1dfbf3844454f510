package com.criteria.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;

import java.util.Map;

/**
 * Safe YAML constructor that keeps plain mapping keys as text.
 * <p>
 * YAML 1.1 resolves keys such as {@code no}, {@code on} or {@code 123} to booleans and numbers;
 * rule documents use keys as field names, so they are read exactly as written. Values keep their
 * usual types.
 */
class RuleYamlConstructor extends SafeConstructor {

    RuleYamlConstructor() {
        super(new LoaderOptions());
    }

    @Override
    protected void constructMapping2ndStep(MappingNode node, Map<Object, Object> mapping) {
        for (NodeTuple tuple : node.getValue()) {
            if (tuple.getKeyNode() instanceof ScalarNode key && !Tag.MERGE.equals(key.getTag())) {
                key.setTag(Tag.STR);
            }
        }
        super.constructMapping2ndStep(node, mapping);
    }
}

package ca.gc.cra.strata.infrastructure.yaml;

import ca.gc.cra.strata.domain.error.StructureException;
import ca.gc.cra.strata.domain.tree.Replacement;
import ca.gc.cra.strata.domain.tree.TaggedMapping;
import java.util.LinkedHashMap;
import java.util.Map;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Safe SnakeYAML constructor understanding local tags.
 *
 * <p>{@code !replace} wraps the annotated value in a {@link Replacement}; any other local tag {@code !name} must
 * annotate a mapping and yields a {@link TaggedMapping} naming the sub-config {@code name}.</p>
 *
 * @since 0.1.0
 */
final class StrataConstructor extends SafeConstructor {
  static final String REPLACE_TAG = "replace";

  private final Resolver resolver = new Resolver();

  StrataConstructor(LoaderOptions options) {
    super(options);
    this.yamlMultiConstructors.put("!", new ConstructLocalTag());
  }

  private final class ConstructLocalTag extends AbstractConstruct {
    @Override
    public Object construct(Node node) {
      String tag = node.getTag().getValue().substring(1);
      if (REPLACE_TAG.equals(tag)) {
        return new Replacement(constructUntagged(node));
      }
      if (!(node instanceof MappingNode)) {
        throw new StructureException("Tag '!" + tag + "' must annotate a mapping", tag);
      }
      Object constructed = constructUntagged(node);
      Map<String, Object> content = new LinkedHashMap<>();
      if (constructed instanceof Map<?, ?> raw) {
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
          if (!(entry.getKey() instanceof String key)) {
            throw new StructureException("Sub-config '" + tag + "' contains non-string key " + entry.getKey(),
                tag);
          }
          content.put(key, entry.getValue());
        }
      }
      return new TaggedMapping(tag, content);
    }

    private Object constructUntagged(Node node) {
      if (node instanceof ScalarNode scalar) {
        node.setTag(resolver.resolve(NodeId.scalar, scalar.getValue(), true));
      } else if (node instanceof SequenceNode) {
        node.setTag(Tag.SEQ);
      } else {
        node.setTag(Tag.MAP);
      }
      return getConstructor(node).construct(node);
    }
  }
}

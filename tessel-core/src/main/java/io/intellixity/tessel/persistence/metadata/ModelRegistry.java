package io.intellixity.tessel.persistence.metadata;

import java.util.*;

/**
 * Registry of all models, keyed by lowercase name.
 * <p>
 * Built in two passes: every definition is turned into {@link ModelMetadata} first, then a linking pass resolves
 * each relation's target, through model and many-to-many counterpart by name. Registration order does not
 * matter, and after {@link #of(Collection)} returns no name-based lookup is needed on the query path.
 * <p>
 * Immutable and safe to share across threads.
 */
public final class ModelRegistry {
  private record Link(int target, int through, CollectionColumn counterpart) {}

  private final List<ModelMetadata> models;
  private final Map<String, Integer> indexByName;
  private final Map<ColumnMetadata, Link> links;

  private ModelRegistry(List<ModelMetadata> models, Map<String, Integer> indexByName, Map<ColumnMetadata, Link> links) {
    this.models = models;
    this.indexByName = indexByName;
    this.links = links;
  }

  public static ModelRegistry of(ModelDefinition... definitions) {
    return of(Arrays.asList(definitions));
  }

  public static ModelRegistry of(Collection<ModelDefinition> definitions) {
    Objects.requireNonNull(definitions, "definitions");
    List<ModelMetadata> models = new ArrayList<>(definitions.size());
    Map<String, Integer> index = new HashMap<>();
    for (ModelDefinition def : definitions) {
      ModelMetadata m = new ModelMetadata(def);
      String key = lower(m.name());
      if (index.putIfAbsent(key, models.size()) != null) {
        throw new ConfigurationException("Model " + m.name() + " is registered more than once");
      }
      models.add(m);
    }

    Map<ColumnMetadata, Link> links = new IdentityHashMap<>();
    for (ModelMetadata m : models) {
      for (ColumnMetadata c : m.columns()) {
        if (c instanceof ModelColumn mc) {
          int target = require(index, m, mc.propertyName(), mc.target(), "model type");
          links.put(mc, new Link(target, -1, null));
        } else if (c instanceof CollectionColumn cc) {
          links.put(cc, linkCollection(models, index, m, cc));
        }
      }
    }
    return new ModelRegistry(List.copyOf(models), Map.copyOf(index), Collections.unmodifiableMap(links));
  }

  private static Link linkCollection(List<ModelMetadata> models, Map<String, Integer> index,
                                     ModelMetadata owner, CollectionColumn cc) {
    int target = require(index, owner, cc.propertyName(), cc.target(), "collection");
    ModelMetadata targetModel = models.get(target);
    if (!cc.manyToMany()) {
      if (!targetModel.hasColumn(cc.via())) {
        throw new ConfigurationException("Unable to find via property '" + cc.via() + "' on " + targetModel.name()
            + " for collection \"" + cc.propertyName() + "\" on \"" + owner.name() + "\"");
      }
      return new Link(target, -1, null);
    }

    int through = require(index, owner, cc.propertyName(), cc.through(), "through model");
    ModelMetadata throughModel = models.get(through);
    if (!throughModel.hasColumn(cc.via())) {
      throw new ConfigurationException("Unable to find via property '" + cc.via() + "' on through model "
          + throughModel.name() + " for collection \"" + cc.propertyName() + "\" on \"" + owner.name() + "\"");
    }

    CollectionColumn counterpart = null;
    for (ColumnMetadata tc : targetModel.columns()) {
      if (tc instanceof CollectionColumn tcc && tcc.manyToMany() && tcc.through().equalsIgnoreCase(cc.through())) {
        counterpart = tcc;
        break;
      }
    }
    if (counterpart == null) {
      throw new ConfigurationException("Unable to find property on related model " + targetModel.name()
          + " for multi-map collection: " + cc.through() + ". From " + owner.name() + "#" + cc.propertyName());
    }
    if (!throughModel.hasColumn(counterpart.via())) {
      throw new ConfigurationException("Unable to find via property '" + counterpart.via() + "' on through model "
          + throughModel.name() + " for collection \"" + counterpart.propertyName() + "\" on \"" + targetModel.name() + "\"");
    }
    return new Link(target, through, counterpart);
  }

  private static int require(Map<String, Integer> index, ModelMetadata owner, String property, String name, String role) {
    Integer i = index.get(lower(name));
    if (i == null) {
      throw new ConfigurationException("Unable to find model schema (" + name + ") specified as " + role
          + " for \"" + property + "\" on \"" + owner.name() + "\"");
    }
    return i;
  }

  private static String lower(String s) {
    return s.toLowerCase(Locale.ROOT);
  }

  public List<ModelMetadata> models() { return models; }

  public Optional<ModelMetadata> find(String name) {
    if (name == null) return Optional.empty();
    Integer i = indexByName.get(lower(name));
    return i == null ? Optional.empty() : Optional.of(models.get(i));
  }

  public ModelMetadata model(String name) {
    return find(name).orElseThrow(() -> new ConfigurationException("Unknown model: " + name));
  }

  /** Target model of a belongs-to or collection column. */
  public ModelMetadata target(ColumnMetadata relation) {
    return models.get(link(relation).target());
  }

  /** Join model of a many-to-many collection. */
  public ModelMetadata through(CollectionColumn collection) {
    Link l = link(collection);
    if (l.through() < 0) throw new ConfigurationException("Collection " + collection.propertyName() + " has no through model");
    return models.get(l.through());
  }

  /** Collection column on the target model sharing this collection's through model. */
  public CollectionColumn counterpart(CollectionColumn collection) {
    Link l = link(collection);
    if (l.counterpart() == null) {
      throw new ConfigurationException("Collection " + collection.propertyName() + " has no many-to-many counterpart");
    }
    return l.counterpart();
  }

  private Link link(ColumnMetadata relation) {
    Link l = links.get(relation);
    if (l == null) throw new ConfigurationException("Column " + relation.propertyName() + " is not a registered relation");
    return l;
  }
}

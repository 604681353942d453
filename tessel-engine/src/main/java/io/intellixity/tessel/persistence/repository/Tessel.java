package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.compile.SqlCompiler;
import io.intellixity.tessel.persistence.exec.Pool;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.metadata.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Bootstrap: one {@link Repository} per registered model over a primary and an optional read pool.
 *
 * <pre>
 * Tessel tessel = Tessel.initialize(ModelRegistry.of(defs), pools.primary(), pools.readonly());
 * tessel.repository("Product").find().where(Where.of("store", 3)).populate("categories").execute();
 * </pre>
 */
public final class Tessel {
  private static final Logger log = LoggerFactory.getLogger(Tessel.class);

  private final ModelRegistry registry;
  private final RepositoriesByName repositories;

  private Tessel(ModelRegistry registry, RepositoriesByName repositories) {
    this.registry = registry;
    this.repositories = repositories;
  }

  public static Tessel initialize(ModelRegistry registry, Pool pool) {
    return initialize(registry, pool, null);
  }

  /** {@code readonlyPool} may be null, in which case {@code pool} also serves reads. */
  public static Tessel initialize(ModelRegistry registry, Pool pool, Pool readonlyPool) {
    return initialize(registry, pool, readonlyPool, new SqlCompiler(Objects.requireNonNull(registry, "registry")));
  }

  public static Tessel initialize(ModelRegistry registry, Pool pool, Pool readonlyPool, SqlCompiler compiler) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(pool, "pool");
    Objects.requireNonNull(compiler, "compiler");
    RepositoryContext context = new RepositoryContext(registry, compiler, pool, readonlyPool);

    Map<String, Repository> byName = new LinkedHashMap<>();
    for (ModelMetadata model : registry.models()) {
      byName.put(model.name().toLowerCase(Locale.ROOT), new Repository(context, model));
    }
    log.info("tessel.initialized models={} readonlyPool={}", byName.size(), readonlyPool != null);
    return new Tessel(registry, new RepositoriesByName(byName));
  }

  public ModelRegistry registry() { return registry; }

  public RepositoriesByName repositories() { return repositories; }

  public Repository repository(String modelName) {
    return repositories.get(modelName);
  }
}

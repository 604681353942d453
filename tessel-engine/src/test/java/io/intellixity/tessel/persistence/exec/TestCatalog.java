package io.intellixity.tessel.persistence.exec;

import io.intellixity.tessel.persistence.metadata.ModelDefinition;
import io.intellixity.tessel.persistence.metadata.ModelRegistry;
import io.intellixity.tessel.persistence.metadata.yaml.ModelDefinitionLoader;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

/** Product, Store, Category and ProductCategory loaded from {@code src/test/resources/models}. */
public final class TestCatalog {
  private TestCatalog() {}

  public static List<ModelDefinition> definitions() {
    try {
      return new ModelDefinitionLoader().loadDir(Path.of(TestCatalog.class.getResource("/models").toURI()));
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  public static ModelRegistry registry() {
    return ModelRegistry.of(definitions());
  }
}

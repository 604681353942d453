package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.exec.CapturingPool;
import io.intellixity.tessel.persistence.exec.TestCatalog;
import io.intellixity.tessel.persistence.metadata.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TesselTest {

  @Test
  void buildsOneRepositoryPerModelKeyedCaseInsensitively() {
    Tessel tessel = Tessel.initialize(TestCatalog.registry(), new CapturingPool());

    assertEquals(4, tessel.repositories().size());
    assertSame(tessel.repository("Product"), tessel.repository("PRODUCT"));
    assertEquals("ProductCategory", tessel.repository("productcategory").model().name());
    assertTrue(tessel.repositories().find("Order").isEmpty());
    assertThrows(ConfigurationException.class, () -> tessel.repository("Order"));
  }

  @Test
  void countValues() {
    assertEquals(0L, Count.of(null).value());
    assertEquals(7L, Count.of(7).value());
    assertEquals(12L, Count.of("12").value());
    assertEquals("18446744073709551615", Count.of("18446744073709551615").value());
    assertThrows(ArithmeticException.class, () -> Count.of("18446744073709551615").longValue());
  }
}

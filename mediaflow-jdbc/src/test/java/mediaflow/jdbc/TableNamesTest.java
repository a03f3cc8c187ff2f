package mediaflow.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

  @Test
  void acceptsPlainIdentifiers() {
    assertEquals("media_transaction", TableNames.validate("media_transaction"));
    assertEquals("_tx2", TableNames.validate("_tx2"));
  }

  @Test
  void rejectsNull() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
  }

  @Test
  void rejectsInjectionAttempts() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("tx; DROP TABLE x"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1tx"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("schema.tx"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
  }
}

package recurrent.jdbc;

import recurrent.expiry.ExpiryCategory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableNamesTest {

  @Test
  void defaultsUseRecurrentPrefix() {
    TableNames names = TableNames.defaults();

    assertEquals("recurrent_aggregated_counter", names.expiry(ExpiryCategory.COUNTER));
    assertEquals("recurrent_job", names.job());
    assertEquals("recurrent_list", names.expiry(ExpiryCategory.LIST));
    assertEquals("recurrent_set", names.set());
    assertEquals("recurrent_hash", names.hash());
    assertEquals("recurrent_state", names.state());
    assertEquals("recurrent_lock", names.lock());
  }

  @Test
  void customPrefixAppliesToEveryTable() {
    TableNames names = TableNames.withPrefix("jobs_");

    assertEquals("jobs_job", names.job());
    assertEquals("jobs_state", names.state());
    assertEquals("jobs_lock", names.lock());
    assertEquals(names, TableNames.withPrefix("jobs_"));
    assertNotEquals(names, TableNames.defaults());
  }

  @Test
  void emptyPrefixIsAllowed() {
    assertEquals("hash", TableNames.withPrefix("").hash());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.withPrefix("jobs-"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.withPrefix("1jobs"));
    assertThrows(NullPointerException.class, () -> TableNames.withPrefix(null));
  }

  @Test
  void validateAcceptsIdentifiers() {
    assertEquals("recurrent_job", TableNames.validate("recurrent_job"));
    assertEquals("_table", TableNames.validate("_table"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("my.table"));
  }
}

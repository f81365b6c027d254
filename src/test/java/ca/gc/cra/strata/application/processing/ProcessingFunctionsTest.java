package ca.gc.cra.strata.application.processing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProcessingFunctionsTest {

  @Test
  void numberInRangeChecksBoundsInclusively() throws Exception {
    ParameterTransform check = ProcessingFunctions.numberInRange(0, 1);

    assertEquals(1, check.apply(1));
    assertNull(check.apply(null));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> check.apply(1.5));
    assertEquals("Invalid value '1.5'. Must be in range [0.0 ; 1.0].", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> check.apply("high"));
  }

  @Test
  void inListComparesStringsCaseInsensitively() throws Exception {
    ParameterTransform check = ProcessingFunctions.inList(List.of("adam", "sgd"));

    assertEquals("ADAM", check.apply("ADAM"));
    assertThrows(IllegalArgumentException.class, () -> check.apply("rmsprop"));
  }
}

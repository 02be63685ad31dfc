/*
 * Copyright (c) 2024-2025 The roaview Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.roaview.modules.dataprocessing.baselinecorrection;

import java.util.Properties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BaselineParametersTest {

  @Test
  void testDefaults() {
    final BaselineParameters defaults = BaselineParameters.defaults();
    Assertions.assertEquals(1e5, defaults.getLambda());
    Assertions.assertEquals(0.01, defaults.getP());
    Assertions.assertEquals(10, defaults.getIterations());
    Assertions.assertNull(defaults.getTolerance());
    Assertions.assertEquals(0d, defaults.getStartWavenumber());
    Assertions.assertEquals(defaults, BaselineParameters.loadDefaults());
  }

  @Test
  void testFromProperties() {
    final Properties properties = new Properties();
    properties.setProperty(BaselineParameters.LAMBDA_KEY, "1e7");
    properties.setProperty(BaselineParameters.TOLERANCE_KEY, "1e-4");
    properties.setProperty(BaselineParameters.START_WAVENUMBER_KEY, " 250 ");

    final BaselineParameters parameters = BaselineParameters.fromProperties(properties);

    Assertions.assertEquals(1e7, parameters.getLambda());
    Assertions.assertEquals(0.01, parameters.getP());
    Assertions.assertEquals(1e-4, parameters.getTolerance());
    Assertions.assertNull(parameters.getMinDelta());
    Assertions.assertEquals(250d, parameters.getStartWavenumber());
  }

  @Test
  void testInvalidValuesAreRejected() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new BaselineParameters(0, 0.01, 10));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new BaselineParameters(1e5, 1, 10));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new BaselineParameters(1e5, 0.01, 0));

    final Properties properties = new Properties();
    properties.setProperty(BaselineParameters.ITERATIONS_KEY, "ten");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> BaselineParameters.fromProperties(properties));
  }
}

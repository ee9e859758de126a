/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.omniint.math;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Number theoretic functions over {@link OmniInt}. */
public class OmniMath {
  private static final Logger LOG = LoggerFactory.getLogger(OmniMath.class);

  private OmniMath() {}

  /**
   * Integer square root by Newton's method,
   * x_{n+1} = (x_n + n/x_n) / 2,
   * starting from 10^ceil(d/2) >= sqrt(n), where d is the number of digits of n.
   * The sequence strictly decreases until it reaches the root.
   *
   * @return floor(sqrt(n))
   * @throws DomainException if n < 0.
   */
  public static OmniInt sqrt(final OmniInt n) {
    if (n.isNegative())
      throw new DomainException("sqrt(" + n.toBrief() + "): negative argument");
    else if (n.isZero())
      return new OmniInt();

    final OmniInt two = OmniInt.valueOf(2);
    OmniInt x = OmniInt.powerOfTen((n.numberOfDigits() + 1) >> 1);
    int iterations = 0;
    for(;;) {
      final OmniInt next = n.divide(x).plusEqual(x).divideEqual(two);
      if (next.isGreaterThanOrEqualTo(x))
        break;
      x = next;
      iterations++;
      if (LOG.isTraceEnabled())
        LOG.trace("sqrt(" + n.toBrief() + "): x_" + iterations + " = " + x.toBrief());
    }

    if (x.multiply(x).isGreaterThan(n))
      x.decrementEqual();

    if (LOG.isDebugEnabled())
      LOG.debug("sqrt(" + n.toBrief() + ") = " + x.toBrief() + " after " + iterations + " iteration(s)");
    return x;
  }

  /**
   * Euclidean algorithm.
   * @return the greatest common divisor of |a| and |b|; gcd(0, 0) = 0.
   */
  public static OmniInt gcd(final OmniInt a, final OmniInt b) {
    OmniInt x = a.abs();
    OmniInt y = b.abs();
    for(; !y.isZero(); ) {
      final OmniInt r = x.modEqual(y);
      x = y;
      y = r;
    }
    return x;
  }

  /**
   * Exponentiation by repeated squaring.
   * @return base^exponent, where 0^0 = 1.
   * @throws DomainException if exponent < 0.
   */
  public static OmniInt pow(final OmniInt base, final int exponent) {
    if (exponent < 0)
      throw new DomainException("pow(" + base.toBrief() + ", " + exponent + "): negative exponent");

    final OmniInt result = OmniInt.valueOf(1);
    final OmniInt square = base.copy();
    for(int e = exponent; e > 0; e >>= 1) {
      if ((e & 1) != 0)
        result.multiplyEqual(square);
      if (e > 1)
        square.multiplyEqual(square);
    }
    return result;
  }
}

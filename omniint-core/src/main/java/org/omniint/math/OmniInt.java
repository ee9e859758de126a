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

import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An arbitrary-precision signed integer stored as decimal digits.
 *
 * The pure operations ({@link #plus(OmniInt)}, {@link #divide(OmniInt)}, ...)
 * return new objects and never modify their arguments.
 * The xxxEqual operations ({@link #plusEqual(OmniInt)}, ...) modify this object
 * only and return it, so that they can be chained.
 *
 * Division truncates toward zero;
 * the remainder has the sign of the dividend.
 */
public class OmniInt implements Comparable<OmniInt> {
  private static final Logger LOG = LoggerFactory.getLogger(OmniInt.class);

  /** The radix of a digit. */
  static final int BASE = 10;
  /** Number of digits shown at each end by {@link #toBrief()}. */
  private static final int BRIEF_DIGITS = 5;

  private static final OmniInt ONE = valueOf(1);
  private static final OmniInt LONG_MAX = valueOf(Long.MAX_VALUE);
  private static final OmniInt LONG_MIN = valueOf(Long.MIN_VALUE);
  private static final OmniInt INT_MAX = valueOf(Integer.MAX_VALUE);
  private static final OmniInt INT_MIN = valueOf(Integer.MIN_VALUE);

  /** Is this >= 0?  Zero is always positive. */
  private boolean positive = true;
  /** Digits, least significant first. */
  private int[] digits;
  /** Total number of digits, not including leading zeros, not digits.length */
  private int nDigits;

  /** Construct zero. */
  public OmniInt() {
    this.digits = new int[1];
    this.nDigits = 1;
  }

  /** Copy constructor. */
  public OmniInt(final OmniInt that) {
    this.positive = that.positive;
    this.digits = Arrays.copyOf(that.digits, that.nDigits);
    this.nDigits = that.nDigits;
  }

  private OmniInt(final boolean positive, final int[] digits, final int nDigits) {
    this.positive = positive;
    this.digits = digits;
    this.nDigits = nDigits;
    trimLeadingZeros();
  }

  public static OmniInt valueOf(final long n) {
    return new OmniInt().set(n);
  }

  /**
   * Parse a decimal integer.
   * @param s text of the form [+|-]digit+
   * @throws InvalidFormatException if s is not of the form above.
   */
  public static OmniInt valueOf(final String s) {
    return new OmniInt().set(s);
  }

  public static OmniInt valueOf(final BigInteger x) {
    return valueOf(x.toString());
  }

  /** @return 10^exponent */
  static OmniInt powerOfTen(final int exponent) {
    if (exponent < 0)
      throw new IllegalArgumentException("exponent = " + exponent + " < 0");
    final int[] d = new int[exponent + 1];
    d[exponent] = 1;
    return new OmniInt(true, d, d.length);
  }

  /**
   * Read the next whitespace-delimited token and parse it.
   * @return the value, or null if the end of the stream is reached
   *         before any token.
   */
  public static OmniInt read(final Reader in) throws IOException {
    int c = in.read();
    for(; c != -1 && Character.isWhitespace(c); c = in.read());
    if (c == -1)
      return null;

    final StringBuilder b = new StringBuilder();
    for(; c != -1 && !Character.isWhitespace(c); c = in.read())
      b.append((char)c);
    return valueOf(b.toString());
  }

  public OmniInt copy() {
    return new OmniInt(this);
  }

  /** Set this to zero. */
  public OmniInt setZero() {
    positive = true;
    digits[0] = 0;
    nDigits = 1;
    return this;
  }

  /** Set this to that. */
  public OmniInt set(final OmniInt that) {
    if (this != that) {
      ensureCapacity(that.nDigits);
      System.arraycopy(that.digits, 0, this.digits, 0, that.nDigits);
      this.nDigits = that.nDigits;
      this.positive = that.positive;
    }
    return this;
  }

  public OmniInt set(final long n) {
    // Long.MIN_VALUE has no positive counterpart, so use unsigned arithmetic
    long magnitude = n >= 0? n: -n;
    ensureCapacity(20);
    nDigits = 0;
    do {
      digits[nDigits++] = (int)Long.remainderUnsigned(magnitude, BASE);
      magnitude = Long.divideUnsigned(magnitude, BASE);
    } while (magnitude != 0);
    positive = n >= 0;
    return this;
  }

  /** @see #valueOf(String) */
  public OmniInt set(final String s) {
    if (s == null)
      throw new InvalidFormatException("s == null");

    int start = 0;
    boolean p = true;
    if (!s.isEmpty()) {
      final char c = s.charAt(0);
      if (c == '+' || c == '-') {
        p = c == '+';
        start = 1;
      }
    }

    final int n = s.length() - start;
    if (n == 0) {
      throw new InvalidFormatException(s.isEmpty()? "Empty string"
          : "No digits after the sign: \"" + s + "\"");
    }

    final int[] d = new int[n];
    for(int i = 0; i < n; i++) {
      final int j = s.length() - 1 - i;
      final char c = s.charAt(j);
      if (c < '0' || c > '9') {
        throw new InvalidFormatException("Unexpected character '" + c
            + "' at index " + j + " of \"" + abbreviate(s) + "\"");
      }
      d[i] = c - '0';
    }

    positive = p;
    digits = d;
    nDigits = n;
    trimLeadingZeros();
    return this;
  }

  private static String abbreviate(final String s) {
    final int max = 4*BRIEF_DIGITS;
    return s.length() <= max? s
        : s.substring(0, max) + "...(" + s.length() + " chars)";
  }

  /////////////////////////////////////////////////////////////////////////////
  private void ensureCapacity(final int n) {
    if (digits == null)
      digits = new int[n];
    else if (digits.length < n)
      digits = Arrays.copyOf(digits, Math.max(n, digits.length << 1));
  }

  /** Remove leading zeros and make sure that zero is positive. */
  private void trimLeadingZeros() {
    for(; nDigits > 1 && digits[nDigits - 1] == 0; nDigits--);
    if (nDigits == 1 && digits[0] == 0)
      positive = true;
  }

  /** Steal the state of that, which must not be used afterwards. */
  private OmniInt assign(final OmniInt that) {
    this.positive = that.positive;
    this.digits = that.digits;
    this.nDigits = that.nDigits;
    return this;
  }

  /** Is this == 0? */
  public boolean isZero() {return nDigits == 1 && digits[0] == 0;}
  /** Is this > 0? */
  public boolean isPositive() {return positive && !isZero();}
  /** Is this < 0? */
  public boolean isNegative() {return !positive && !isZero();}
  public boolean isEven() {return (digits[0] & 1) == 0;}

  /** @return -1, 0 or 1 as this is negative, zero or positive. */
  public int signum() {
    return isZero()? 0: positive? 1: -1;
  }

  /** @return the number of decimal digits, ignoring the sign; zero has one digit. */
  public int numberOfDigits() {return nDigits;}

  /////////////////////////////////////////////////////////////////////////////
  @Override
  public int compareTo(final OmniInt that) {
    if (this == that || (this.isZero() && that.isZero())) {
      return 0;
    } else if (this.positive != that.positive) {
      return this.positive? 1: -1;
    } else {
      final int d = this.compareMagnitudeTo(that);
      return positive? d: -d;
    }
  }

  /** Compare |this| and |that|. */
  public int compareMagnitudeTo(final OmniInt that) {
    if (this == that) {
      return 0;
    } else if (this.nDigits != that.nDigits) {
      return this.nDigits > that.nDigits? 1: -1;
    } else {
      for(int i = nDigits - 1; i >= 0; i--)
        if (this.digits[i] != that.digits[i])
          return this.digits[i] > that.digits[i]? 1: -1;
      return 0;
    }
  }

  public boolean isLessThan(final OmniInt that) {return compareTo(that) < 0;}
  public boolean isLessThanOrEqualTo(final OmniInt that) {return compareTo(that) <= 0;}
  public boolean isGreaterThan(final OmniInt that) {return compareTo(that) > 0;}
  public boolean isGreaterThanOrEqualTo(final OmniInt that) {return compareTo(that) >= 0;}

  @Override
  public boolean equals(final Object that) {
    if (this == that)
      return true;
    else if (that instanceof OmniInt)
      return compareTo((OmniInt)that) == 0;
    else
      return false;
  }

  @Override
  public int hashCode() {
    int h = positive? 1: -1;
    for(int i = 0; i < nDigits; i++)
      h = 31*h + digits[i];
    return h;
  }

  /////////////////////////////////////////////////////////////////////////////
  /** this = -this */
  public OmniInt negateEqual() {
    if (!isZero())
      positive = !positive;
    return this;
  }

  /** this = |this| */
  public OmniInt absEqual() {
    positive = true;
    return this;
  }

  /** this += that */
  public OmniInt plusEqual(final OmniInt that) {
    if (this.positive == that.positive) {
      addMagnitude(that);
    } else if (this.compareMagnitudeTo(that) < 0) {
      subtractMagnitudeFrom(that);
      positive = that.positive;
    } else {
      subtractMagnitude(that);
    }
    return this;
  }

  /** this += n */
  public OmniInt plusEqual(final long n) {
    return plusEqual(valueOf(n));
  }

  /** this -= that */
  public OmniInt minusEqual(final OmniInt that) {
    if (this == that) {
      return setZero();
    } else if (this.positive != that.positive) {
      addMagnitude(that);
    } else if (this.compareMagnitudeTo(that) < 0) {
      subtractMagnitudeFrom(that);
      positive = !positive;
    } else {
      subtractMagnitude(that);
    }
    return this;
  }

  /** this -= n */
  public OmniInt minusEqual(final long n) {
    return minusEqual(valueOf(n));
  }

  /** ++this */
  public OmniInt incrementEqual() {
    return plusEqual(ONE);
  }

  /** --this */
  public OmniInt decrementEqual() {
    return minusEqual(ONE);
  }

  /** this++ */
  public OmniInt getAndIncrement() {
    final OmniInt previous = copy();
    incrementEqual();
    return previous;
  }

  /** this-- */
  public OmniInt getAndDecrement() {
    final OmniInt previous = copy();
    decrementEqual();
    return previous;
  }

  /** |this| += |that|.  The sign is unchanged. */
  private void addMagnitude(final OmniInt that) {
    final int n = Math.max(this.nDigits, that.nDigits);
    ensureCapacity(n + 1);

    int carry = 0;
    int i = 0;
    for(; i < n || carry != 0; i++) {
      int sum = carry;
      if (i < this.nDigits)
        sum += this.digits[i];
      if (i < that.nDigits)
        sum += that.digits[i];
      this.digits[i] = sum % BASE;
      carry = sum / BASE;
    }
    nDigits = i;
  }

  /** |this| -= |that|, given |this| >= |that|.  The sign is unchanged unless the result is zero. */
  private void subtractMagnitude(final OmniInt that) {
    int borrow = 0;
    for(int i = 0; i < nDigits && (borrow != 0 || i < that.nDigits); i++) {
      int diff = digits[i] - borrow;
      if (i < that.nDigits)
        diff -= that.digits[i];
      if (diff < 0) {
        diff += BASE;
        borrow = 1;
      } else {
        borrow = 0;
      }
      digits[i] = diff;
    }
    if (borrow != 0)
      throw new IllegalStateException("|this| < |that|, this=" + toBrief() + ", that=" + that.toBrief());
    trimLeadingZeros();
  }

  /** |this| = |that| - |this|, given |that| > |this|.  The sign is unchanged. */
  private void subtractMagnitudeFrom(final OmniInt that) {
    ensureCapacity(that.nDigits);
    int borrow = 0;
    for(int i = 0; i < that.nDigits; i++) {
      int diff = that.digits[i] - borrow;
      if (i < this.nDigits)
        diff -= this.digits[i];
      if (diff < 0) {
        diff += BASE;
        borrow = 1;
      } else {
        borrow = 0;
      }
      this.digits[i] = diff;
    }
    if (borrow != 0)
      throw new IllegalStateException("|that| < |this|, this=" + toBrief() + ", that=" + that.toBrief());
    nDigits = that.nDigits;
    trimLeadingZeros();
  }

  /** this *= that, using the classical quadratic algorithm. */
  public OmniInt multiplyEqual(final OmniInt that) {
    if (this.isZero() || that.isZero())
      return setZero();

    // sum the products in slots first, which may exceed a digit
    final long[] slots = new long[this.nDigits + that.nDigits];
    for(int i = 0; i < this.nDigits; i++) {
      final long a = this.digits[i];
      if (a != 0)
        for(int j = 0; j < that.nDigits; j++)
          slots[i + j] += a*that.digits[j];
    }

    // carry in a single pass
    int[] d = new int[slots.length];
    int n = 0;
    long carry = 0;
    for(; n < slots.length; n++) {
      carry += slots[n];
      d[n] = (int)(carry % BASE);
      carry /= BASE;
    }
    for(; carry != 0; carry /= BASE) {
      if (n == d.length)
        d = Arrays.copyOf(d, n + 1);
      d[n++] = (int)(carry % BASE);
    }

    this.positive = this.positive == that.positive;
    this.digits = d;
    this.nDigits = n;
    trimLeadingZeros();
    return this;
  }

  /**
   * The combined division:
   * quotient = this / divisor, truncated toward zero,
   * this     = this % divisor, with the sign of the dividend.
   * @return quotient
   * @throws DivisionByZeroException if divisor is zero.
   */
  public OmniInt divideRemainderEqual(final OmniInt divisor) {
    if (divisor.isZero())
      throw new DivisionByZeroException("Division by zero: " + toBrief() + " / 0");
    if (this.compareMagnitudeTo(divisor) < 0)
      return new OmniInt();

    final OmniInt d = divisor == this? divisor.copy(): divisor;
    final boolean quotientPositive = this.positive == d.positive;
    if (LOG.isTraceEnabled())
      LOG.trace("divideRemainderEqual: " + toBrief() + " / " + d.toBrief());

    final OmniInt[] multiples = multiplesOf(d);
    final int[] q = new int[nDigits];
    final OmniInt r = new OmniInt();
    for(int i = nDigits - 1; i >= 0; i--) {
      r.appendDigit(digits[i]);
      final int k = largestMultipleNotExceeding(multiples, r);
      if (k > 0)
        r.subtractMagnitude(multiples[k]);
      q[i] = k;
    }

    final OmniInt quotient = new OmniInt(quotientPositive, q, q.length);
    r.positive = this.positive;
    assign(r).trimLeadingZeros();

    if (LOG.isTraceEnabled())
      LOG.trace("divideRemainderEqual returns quotient=" + quotient.toBrief() + ", remainder=" + toBrief());
    return quotient;
  }

  /** @return {0|d|, 1|d|, ..., 9|d|} */
  private static OmniInt[] multiplesOf(final OmniInt d) {
    final OmniInt[] multiples = new OmniInt[BASE];
    multiples[0] = new OmniInt();
    final OmniInt abs = d.abs();
    for(int k = 1; k < BASE; k++)
      multiples[k] = multiples[k - 1].copy().plusEqual(abs);
    return multiples;
  }

  /** Binary search for the largest k such that multiples[k] <= r. */
  private static int largestMultipleNotExceeding(final OmniInt[] multiples, final OmniInt r) {
    int lower = 0;
    int upper = multiples.length - 1;
    for(; lower < upper; ) {
      final int mid = (lower + upper + 1) >>> 1;
      if (multiples[mid].compareMagnitudeTo(r) <= 0)
        lower = mid;
      else
        upper = mid - 1;
    }
    return lower;
  }

  /** this = this * BASE + digit, given this >= 0. */
  private void appendDigit(final int digit) {
    if (isZero()) {
      digits[0] = digit;
    } else {
      ensureCapacity(nDigits + 1);
      System.arraycopy(digits, 0, digits, 1, nDigits);
      digits[0] = digit;
      nDigits++;
    }
  }

  /** this /= divisor */
  public OmniInt divideEqual(final OmniInt divisor) {
    return assign(divideRemainderEqual(divisor));
  }

  /** this %= divisor */
  public OmniInt modEqual(final OmniInt divisor) {
    divideRemainderEqual(divisor);
    return this;
  }

  /////////////////////////////////////////////////////////////////////////////
  public OmniInt negate() {return copy().negateEqual();}
  public OmniInt abs() {return copy().absEqual();}
  public OmniInt plus(final OmniInt that) {return copy().plusEqual(that);}
  public OmniInt minus(final OmniInt that) {return copy().minusEqual(that);}
  public OmniInt multiply(final OmniInt that) {return copy().multiplyEqual(that);}
  public OmniInt divide(final OmniInt divisor) {return copy().divideRemainderEqual(divisor);}
  public OmniInt mod(final OmniInt divisor) {return copy().modEqual(divisor);}

  /** @return {this / divisor, this % divisor} */
  public OmniInt[] divideAndRemainder(final OmniInt divisor) {
    final OmniInt remainder = copy();
    final OmniInt quotient = remainder.divideRemainderEqual(divisor);
    return new OmniInt[]{quotient, remainder};
  }

  /////////////////////////////////////////////////////////////////////////////
  /**
   * @return this as a long.
   * @throws OverflowException if this is outside the range of long.
   */
  public long longValueExact() {
    if (compareTo(LONG_MAX) > 0 || compareTo(LONG_MIN) < 0) {
      throw new OverflowException(toBrief() + " is outside the range of long ["
          + Long.MIN_VALUE + ", " + Long.MAX_VALUE + "]");
    }
    return accumulate();
  }

  /**
   * @return this as an int.
   * @throws OverflowException if this is outside the range of int.
   */
  public int intValueExact() {
    if (compareTo(INT_MAX) > 0 || compareTo(INT_MIN) < 0) {
      throw new OverflowException(toBrief() + " is outside the range of int ["
          + Integer.MIN_VALUE + ", " + Integer.MAX_VALUE + "]");
    }
    return (int)accumulate();
  }

  /** Accumulate negatively so that Long.MIN_VALUE does not overflow. */
  private long accumulate() {
    long r = 0;
    for(int i = nDigits - 1; i >= 0; i--)
      r = r*BASE - digits[i];
    return positive? -r: r;
  }

  public BigInteger toBigInteger() {
    return new BigInteger(toString());
  }

  /** @return the canonical decimal representation. */
  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder(nDigits + 1);
    if (!positive)
      b.append('-');
    for(int i = nDigits - 1; i >= 0; i--)
      b.append((char)('0' + digits[i]));
    return b.toString();
  }

  /** @return a short description, showing only the leading and trailing digits of a long number. */
  public String toBrief() {
    if (nDigits <= 2*BRIEF_DIGITS)
      return toString();

    final StringBuilder b = new StringBuilder();
    if (!positive)
      b.append('-');
    for(int i = nDigits - 1; i >= nDigits - BRIEF_DIGITS; i--)
      b.append((char)('0' + digits[i]));
    b.append("...");
    for(int i = BRIEF_DIGITS - 1; i >= 0; i--)
      b.append((char)('0' + digits[i]));
    return b.append(" (").append(nDigits).append(" digits)").toString();
  }
}

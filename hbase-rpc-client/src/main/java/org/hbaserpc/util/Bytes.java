// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.hbaserpc.util;

import java.util.Comparator;

import com.google.common.primitives.UnsignedBytes;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Helper functions to manipulate byte arrays holding table names and row keys.
 */
@InterfaceAudience.Private
public final class Bytes {

  /** Orders byte arrays the way HBase orders row keys: unsigned, lexicographically. */
  public static final Comparator<byte[]> MEMCMP = UnsignedBytes.lexicographicalComparator();

  public static final byte[] EMPTY_ARRAY = new byte[0];

  private Bytes() {
  }

  /**
   * {@code memcmp} in Java, hooray.
   * @param a first non-null byte array to compare
   * @param b second non-null byte array to compare
   * @return 0 if the two arrays are identical, a negative number if {@code a} sorts first,
   * a positive number otherwise
   */
  public static int memcmp(final byte[] a, final byte[] b) {
    return MEMCMP.compare(a, b);
  }

  /**
   * Pretty-prints a byte array into a human-readable output buffer.
   * Printable ASCII characters are kept as is, everything else is escaped as {@code \xNN}.
   * @param outbuf the buffer to append to
   * @param array the (possibly {@code null}) array to pretty-print
   */
  public static void pretty(final StringBuilder outbuf, final byte[] array) {
    if (array == null) {
      outbuf.append("null");
      return;
    }
    outbuf.append('"');
    for (final byte b : array) {
      if (b >= ' ' && b < 0x7F && b != '"' && b != '\\') {
        outbuf.append((char) b);
      } else {
        outbuf.append(String.format("\\x%02X", b & 0xFF));
      }
    }
    outbuf.append('"');
  }

  /**
   * Pretty-prints a byte array into a human-readable string.
   * @param array the (possibly {@code null}) array to pretty-print
   * @return the array in a quoted, escaped form, e.g. {@code "row\x00"}
   */
  public static String pretty(final byte[] array) {
    if (array == null) {
      return "null";
    }
    final StringBuilder buf = new StringBuilder(2 + array.length);
    pretty(buf, array);
    return buf.toString();
  }
}

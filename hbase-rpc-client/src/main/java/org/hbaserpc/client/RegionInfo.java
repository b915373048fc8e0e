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

package org.hbaserpc.client;

import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

import org.hbaserpc.util.Bytes;

/**
 * Describes a region: a contiguous range of row keys of a table, served by one RegionServer at
 * a time.
 * <p>
 * The start key is inclusive, the stop key is exclusive. An empty start key means the region is
 * the first one of the table, an empty stop key means it is the last one.
 * <p>
 * This class is immutable, but doesn't copy the arrays it's given.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public final class RegionInfo {

  private final byte[] table;
  private final byte[] regionName;
  private final byte[] startKey;
  private final byte[] stopKey;

  /**
   * @param table the name of the table the region belongs to
   * @param regionName the name of the region, e.g. {@code "table,start,1234567890042.md5."}
   * @param startKey the first row key of the region (inclusive)
   * @param stopKey the end of the region (exclusive), empty if the region ends the table
   */
  public RegionInfo(byte[] table, byte[] regionName, byte[] startKey, byte[] stopKey) {
    this.table = Preconditions.checkNotNull(table);
    this.regionName = Preconditions.checkNotNull(regionName);
    this.startKey = Preconditions.checkNotNull(startKey);
    this.stopKey = Preconditions.checkNotNull(stopKey);
    Preconditions.checkArgument(stopKey.length == 0 || Bytes.memcmp(startKey, stopKey) < 0,
        "start key %s must sort before stop key %s",
        Bytes.pretty(startKey), Bytes.pretty(stopKey));
  }

  public byte[] getTable() {
    return table;
  }

  public byte[] getRegionName() {
    return regionName;
  }

  public byte[] getStartKey() {
    return startKey;
  }

  public byte[] getStopKey() {
    return stopKey;
  }

  /**
   * @param key a row key of this region's table
   * @return true if the key falls in this region's range
   */
  public boolean containsKey(byte[] key) {
    return Bytes.memcmp(startKey, key) <= 0 && isBeforeStopKey(key);
  }

  /**
   * @return true if the key sorts before this region's stop key, which is always the case when
   * the region ends the table
   */
  boolean isBeforeStopKey(byte[] key) {
    return stopKey.length == 0 || Bytes.memcmp(key, stopKey) < 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RegionInfo)) {
      return false;
    }
    RegionInfo that = (RegionInfo) o;
    return Arrays.equals(table, that.table) &&
        Arrays.equals(regionName, that.regionName) &&
        Arrays.equals(startKey, that.startKey) &&
        Arrays.equals(stopKey, that.stopKey);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(table);
    result = 31 * result + Arrays.hashCode(regionName);
    result = 31 * result + Arrays.hashCode(startKey);
    result = 31 * result + Arrays.hashCode(stopKey);
    return result;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder(32 + table.length + regionName.length +
                                                startKey.length + stopKey.length);
    buf.append("RegionInfo(table=");
    Bytes.pretty(buf, table);
    buf.append(", region_name=");
    Bytes.pretty(buf, regionName);
    buf.append(", start_key=");
    Bytes.pretty(buf, startKey);
    buf.append(", stop_key=");
    Bytes.pretty(buf, stopKey);
    buf.append(')');
    return buf.toString();
  }
}

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

import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.hbaserpc.util.Bytes;

/**
 * A cache of region locations, keyed by table and region start key.
 * <p>
 * Entries of a table are ordered by start key, so that the region owning a row key is the entry
 * with the greatest start key lower than or equal to the row key, provided the row key is also
 * lower than that region's stop key. Caching a region replaces the entry with the same start key
 * and leaves the other entries of the table untouched: this is how a region that split or moved
 * gets updated.
 * <p>
 * A miss means the location has to be looked up in the meta table, which is up to the caller.
 */
@ThreadSafe
@InterfaceAudience.Private
@InterfaceStability.Unstable
public class RegionLocationCache {
  private static final Logger LOG = LoggerFactory.getLogger(RegionLocationCache.class);

  private final ReentrantReadWriteLock rwl = new ReentrantReadWriteLock();

  /** Table name to the regions of the table, keyed by start key. */
  @GuardedBy("rwl")
  private final NavigableMap<byte[], NavigableMap<byte[], Entry>> regions =
      new TreeMap<>(Bytes.MEMCMP);

  /**
   * Finds the cached region that serves the given row key.
   *
   * @param table the table the row belongs to
   * @param key the row key; the empty key is the first row of the table
   * @return the entry for the region, or {@code null} if no cached region contains the key
   */
  @Nullable
  public Entry get(byte[] table, byte[] key) {
    Map.Entry<byte[], Entry> floor;
    rwl.readLock().lock();
    try {
      NavigableMap<byte[], Entry> tableRegions = regions.get(table);
      if (tableRegions == null) {
        return null;
      }
      floor = tableRegions.floorEntry(key);
    } finally {
      rwl.readLock().unlock();
    }

    if (floor == null || !floor.getValue().getRegion().isBeforeStopKey(key)) {
      if (LOG.isTraceEnabled()) {
        LOG.trace("No cached region for table {} key {}", Bytes.pretty(table), Bytes.pretty(key));
      }
      return null;
    }
    return floor.getValue();
  }

  /**
   * Caches the location of a region, replacing the region previously cached with the same start
   * key in the same table, if any.
   *
   * @param region the region to cache
   * @param client the connection to the RegionServer serving the region
   */
  public void cacheRegion(RegionInfo region, RegionClient client) {
    Preconditions.checkNotNull(region);
    Preconditions.checkNotNull(client);
    final Entry entry = new Entry(region, client);
    Entry previous;
    rwl.writeLock().lock();
    try {
      NavigableMap<byte[], Entry> tableRegions = regions.get(region.getTable());
      if (tableRegions == null) {
        tableRegions = new TreeMap<>(Bytes.MEMCMP);
        regions.put(region.getTable(), tableRegions);
      }
      previous = tableRegions.put(region.getStartKey(), entry);
    } finally {
      rwl.writeLock().unlock();
    }
    if (previous != null) {
      LOG.debug("Replaced cached region {} with {}", previous, entry);
    } else {
      LOG.debug("Cached region {}", entry);
    }
  }

  /**
   * Removes a region from the cache, if it's still the one cached for its start key.
   *
   * @param region the region known not to be served where the cache says it is
   * @return true if the region was removed
   */
  public boolean invalidate(RegionInfo region) {
    rwl.writeLock().lock();
    try {
      NavigableMap<byte[], Entry> tableRegions = regions.get(region.getTable());
      if (tableRegions == null) {
        return false;
      }
      Entry entry = tableRegions.get(region.getStartKey());
      if (entry == null || !entry.getRegion().equals(region)) {
        // Already replaced with fresher information.
        return false;
      }
      tableRegions.remove(region.getStartKey());
      if (tableRegions.isEmpty()) {
        regions.remove(region.getTable());
      }
    } finally {
      rwl.writeLock().unlock();
    }
    LOG.debug("Invalidated cached region {}", region);
    return true;
  }

  /**
   * Removes every region served through the given connection, e.g. because it died.
   *
   * @param client the connection
   * @return the number of regions removed
   */
  public int removeRegionsServedBy(RegionClient client) {
    int removed = 0;
    rwl.writeLock().lock();
    try {
      Iterator<NavigableMap<byte[], Entry>> tables = regions.values().iterator();
      while (tables.hasNext()) {
        NavigableMap<byte[], Entry> tableRegions = tables.next();
        Iterator<Entry> it = tableRegions.values().iterator();
        while (it.hasNext()) {
          if (it.next().getClient() == client) {
            it.remove();
            removed++;
          }
        }
        if (tableRegions.isEmpty()) {
          tables.remove();
        }
      }
    } finally {
      rwl.writeLock().unlock();
    }
    if (removed > 0) {
      LOG.debug("Removed {} cached regions served by {}", removed, client);
    }
    return removed;
  }

  /**
   * Removes all the entries from the cache.
   */
  public void clear() {
    rwl.writeLock().lock();
    try {
      regions.clear();
    } finally {
      rwl.writeLock().unlock();
    }
  }

  /**
   * @return the number of regions cached, across all tables
   */
  public int size() {
    rwl.readLock().lock();
    try {
      int size = 0;
      for (NavigableMap<byte[], Entry> tableRegions : regions.values()) {
        size += tableRegions.size();
      }
      return size;
    } finally {
      rwl.readLock().unlock();
    }
  }

  @Override
  public String toString() {
    rwl.readLock().lock();
    try {
      StringBuilder buf = new StringBuilder("[");
      for (NavigableMap<byte[], Entry> tableRegions : regions.values()) {
        for (Entry entry : tableRegions.values()) {
          if (buf.length() > 1) {
            buf.append(", ");
          }
          buf.append(entry);
        }
      }
      return buf.append(']').toString();
    } finally {
      rwl.readLock().unlock();
    }
  }

  /**
   * An entry in the cache: a region and the connection to the server that serves it.
   */
  public static final class Entry {
    private final RegionInfo region;
    private final RegionClient client;

    Entry(RegionInfo region, RegionClient client) {
      this.region = region;
      this.client = client;
    }

    public RegionInfo getRegion() {
      return region;
    }

    public RegionClient getClient() {
      return client;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper("Region")
                        .add("name", Bytes.pretty(region.getRegionName()))
                        .add("startKey", Bytes.pretty(region.getStartKey()))
                        .add("stopKey", Bytes.pretty(region.getStopKey()))
                        .add("server", client.getServerInfo())
                        .toString();
    }
  }
}

/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.fortx.sched;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.log4j.Logger;

import exm.fortx.common.Logging;
import exm.fortx.ir.Program.ReplacementListener;
import exm.fortx.ir.SourceUnit;
import exm.fortx.ir.UnitId;
import exm.fortx.ir.Units.Routine;

/**
 * Results of passes per unit, keyed by pass name and input fingerprint.
 * Each unit has its own lock, held by the scheduler while it looks up,
 * runs and stores a unit's result.
 */
public class PassResultCache implements ReplacementListener {

  private final Logger logger = Logging.getLogger();

  private final ConcurrentMap<UnitId, Map<String, PassResult>> entries =
          new ConcurrentHashMap<UnitId, Map<String, PassResult>>();
  private final ConcurrentMap<UnitId, ReentrantLock> locks =
          new ConcurrentHashMap<UnitId, ReentrantLock>();

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  public ReentrantLock lock(UnitId unit) {
    ReentrantLock lock = locks.get(unit);
    if (lock == null) {
      ReentrantLock newLock = new ReentrantLock();
      lock = locks.putIfAbsent(unit, newLock);
      if (lock == null) {
        lock = newLock;
      }
    }
    return lock;
  }

  /**
   * @return cached result, or null
   */
  public PassResult get(UnitId unit, String pass, String fingerprint) {
    Map<String, PassResult> m = entries.get(unit);
    PassResult r = m == null ? null : m.get(key(pass, fingerprint));
    if (r != null) {
      hits.incrementAndGet();
    } else {
      misses.incrementAndGet();
    }
    return r;
  }

  public void put(UnitId unit, String pass, String fingerprint,
                  PassResult result) {
    Map<String, PassResult> m = entries.get(unit);
    if (m == null) {
      Map<String, PassResult> newMap =
            new ConcurrentHashMap<String, PassResult>();
      m = entries.putIfAbsent(unit, newMap);
      if (m == null) {
        m = newMap;
      }
    }
    m.put(key(pass, fingerprint), result);
  }

  /**
   * Drop all entries of a unit
   */
  public void invalidate(UnitId unit) {
    ReentrantLock lock = lock(unit);
    lock.lock();
    try {
      if (entries.remove(unit) != null) {
        logger.trace("Invalidated cached pass results of " + unit);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void routineReplaced(SourceUnit source, UnitId id,
                              Routine oldRoutine, Routine newRoutine) {
    invalidate(id);
  }

  @Override
  public void routineAdded(SourceUnit source, UnitId id, Routine routine) {
    invalidate(id);
  }

  public long hits() {
    return hits.get();
  }

  public long misses() {
    return misses.get();
  }

  private static String key(String pass, String fingerprint) {
    return pass + "@" + fingerprint;
  }
}

// ******************************************************************************
//
// Title:       RIES.
// Description: RIES - Resonances Integrated over Energy and Space.
// Copyright:   Copyright (c) RIES Developers 2026.
//
// This file is part of RIES.
//
// RIES is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// RIES is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// RIES; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package ries.utilities;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * A logging Handler that keeps the records it receives, so that diagnostics emitted through
 * java.util.logging can be inspected.
 */
public class LogRecordCollector extends Handler implements AutoCloseable {

  private final Logger observed;
  private final Level previousLevel;
  private final List<LogRecord> records = new ArrayList<>();

  private LogRecordCollector(Logger observed, Level level) {
    this.observed = observed;
    this.previousLevel = observed.getLevel();
    setLevel(level);
    // The observed logger must at least pass records at the collected level.
    if (previousLevel == null || previousLevel.intValue() > level.intValue()) {
      observed.setLevel(level);
    }
  }

  /**
   * Attach a new collector to a logger.
   *
   * @param logger the Logger to observe.
   * @param level the minimum Level of the collected records.
   * @return the collector.
   */
  public static LogRecordCollector attach(Logger logger, Level level) {
    LogRecordCollector collector = new LogRecordCollector(logger, level);
    logger.addHandler(collector);
    return collector;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void publish(LogRecord record) {
    if (isLoggable(record)) {
      records.add(record);
    }
  }

  /**
   * The collected records.
   *
   * @return a copy of the records received so far.
   */
  public synchronized List<LogRecord> getRecords() {
    return new ArrayList<>(records);
  }

  /**
   * Number of collected records.
   *
   * @return the count.
   */
  public synchronized int size() {
    return records.size();
  }

  /**
   * Check whether any collected message contains the given text.
   *
   * @param text the text to search for.
   * @return true if a message contains the text.
   */
  public synchronized boolean contains(String text) {
    for (LogRecord record : records) {
      if (record.getMessage() != null && record.getMessage().contains(text)) {
        return true;
      }
    }
    return false;
  }

  /** {@inheritDoc} */
  @Override
  public void flush() {
    // Records are held in memory.
  }

  /** Detach this collector and restore the level of the observed logger. */
  @Override
  public void close() {
    observed.removeHandler(this);
    observed.setLevel(previousLevel);
  }
}

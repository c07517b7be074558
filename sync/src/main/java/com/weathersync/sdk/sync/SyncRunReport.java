/*
 * Copyright © 2017 Google Inc.
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
 * limitations under the License.
 */
package com.weathersync.sdk.sync;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/** Per-entity outcomes of one {@link SyncRunner#run}. */
public final class SyncRunReport {
  private final ImmutableList<EntitySyncReport> reports;

  SyncRunReport(List<EntitySyncReport> reports) {
    this.reports = ImmutableList.copyOf(reports);
  }

  /** Gets the reports, in the order the entities were requested. */
  public ImmutableList<EntitySyncReport> getReports() {
    return reports;
  }

  public ImmutableList<EntitySyncReport> getFailures() {
    return reports.stream().filter(r -> !r.isSuccess()).collect(ImmutableList.toImmutableList());
  }

  public boolean isSuccess() {
    return reports.stream().allMatch(EntitySyncReport::isSuccess);
  }

  public Optional<EntitySyncReport> getReport(String entityId) {
    return reports.stream().filter(r -> r.getEntityId().equals(entityId)).findFirst();
  }

  @Override
  public String toString() {
    return "SyncRunReport [entities=" + reports.size() + ", failures=" + getFailures() + "]";
  }
}

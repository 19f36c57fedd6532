/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.ghost.content;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.ghost.api.RevisionInfo;
import org.junit.Test;

public class PendingRevisionsTest {

    private final PendingRevisions pending = new PendingRevisions();

    @Test
    public void emptyListRemovesFolder() {
        pending.put("flows", ImmutableList.of(revision(1, "a.json")));
        assertEquals(1, pending.snapshot().get("flows").size());

        pending.put("flows", ImmutableList.<RevisionInfo>of());
        assertTrue(pending.snapshot().isEmpty());
    }

    @Test
    public void snapshotIsDetached() {
        List<RevisionInfo> revisions = new ArrayList<RevisionInfo>();
        revisions.add(revision(1, "a.json"));
        pending.put("flows", revisions);
        revisions.add(revision(2, "b.json"));

        Map<String, List<RevisionInfo>> snapshot = pending.snapshot();
        pending.put("other", ImmutableList.of(revision(3, "c.json")));

        assertEquals(1, snapshot.get("flows").size());
        assertFalse(snapshot.containsKey("other"));
        assertEquals(2, pending.snapshot().size());
    }

    private static RevisionInfo revision(long id, String file) {
        return new RevisionInfo(id, file, "rev-" + id, 1000L * id, "admin");
    }
}

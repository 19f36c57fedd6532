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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.apache.jackrabbit.ghost.api.GhostContentManager.REVISIONS_FILE_NAME;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.io.FileUtils;
import org.apache.jackrabbit.ghost.api.GhostContentException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class KnownRevisionsTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder(new File("target"));

    private NormalizedFolder flows;

    @Before
    public void setUp() {
        flows = new FolderNormalizer(folder.getRoot()).normalize("flows");
    }

    @Test
    public void missingManifest() throws Exception {
        assertTrue(KnownRevisions.read(flows).isEmpty());
    }

    @Test
    public void missingFolder() throws Exception {
        NormalizedFolder missing = new FolderNormalizer(folder.getRoot()).normalize("does/not/exist");
        assertTrue(KnownRevisions.read(missing).isEmpty());
    }

    @Test
    public void commentsAndBlankLines() throws Exception {
        FileUtils.writeStringToFile(flows.resolve(REVISIONS_FILE_NAME),
                "# released 2024-03-01\n"
                        + "4a1c7e1e-0b7a-4f6e-9d3c-2f0c2b7d1a11\n"
                        + "\n"
                        + "   \n"
                        + "  9f3b2c44-5d1e-4b8a-8c6f-7e2d1a0b3c22  \r\n"
                        + "#9f3b2c44-0000-0000-0000-000000000000\n", UTF_8);
        assertEquals(ImmutableSet.of(
                "4a1c7e1e-0b7a-4f6e-9d3c-2f0c2b7d1a11",
                "9f3b2c44-5d1e-4b8a-8c6f-7e2d1a0b3c22"), KnownRevisions.read(flows));
    }

    @Test
    public void unreadableManifest() throws IOException {
        assertTrue(flows.resolve(REVISIONS_FILE_NAME).mkdirs());
        try {
            KnownRevisions.read(flows);
            fail("must fail on a manifest which is a directory");
        } catch (GhostContentException e) {
            assertTrue(e.isManifestFailure());
            assertEquals(1, e.getCode());
        }
    }
}

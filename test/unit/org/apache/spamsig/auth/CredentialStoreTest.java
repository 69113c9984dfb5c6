/*
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
package org.apache.spamsig.auth;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import org.apache.spamsig.exceptions.InvalidLineException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CredentialStoreTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void missingFileGivesNoAccounts() throws Exception
    {
        Path missing = folder.getRoot().toPath().resolve("passwd");
        assertTrue(CredentialStore.loadServerAccounts(missing).isEmpty());
    }

    @Test
    public void loadsAccounts() throws Exception
    {
        Path file = write("# username : key",
                          "alice : 3bd9a3c6b3b9ee",
                          "",
                          "bob:  secret  ");
        assertEquals(ImmutableMap.of("alice", "3bd9a3c6b3b9ee", "bob", "secret"),
                     CredentialStore.loadServerAccounts(file));
    }

    @Test
    public void malformedLinesAreSkipped() throws Exception
    {
        Path file = write("onlyonepart",
                          "alice : key",
                          "too : many : parts");
        assertEquals(ImmutableMap.of("alice", "key"), CredentialStore.loadServerAccounts(file));
    }

    @Test
    public void laterDuplicateWins() throws Exception
    {
        Path file = write("alice : first",
                          "alice : second");
        assertEquals(ImmutableMap.of("alice", "second"), CredentialStore.loadServerAccounts(file));
    }

    @Test
    public void parseLineRejectsSinglePart()
    {
        assertThatThrownBy(() -> CredentialStore.parseLine("onlyonepart"))
            .isInstanceOf(InvalidLineException.class);
    }

    @Test
    public void parseLineTrimsFields() throws Exception
    {
        Map.Entry<String, String> account = CredentialStore.parseLine("  alice  :  key ");
        assertEquals("alice", account.getKey());
        assertEquals("key", account.getValue());
    }

    @Test
    public void reloadReplacesAccounts() throws Exception
    {
        Path file = write("alice : one");
        CredentialStore store = new CredentialStore(file);
        assertTrue(store.usernames().isEmpty());

        store.reload();
        assertEquals(Optional.of("one"), store.getKey("alice"));
        assertEquals(Optional.empty(), store.getKey("bob"));

        Files.write(file, Arrays.asList("bob : two"), StandardCharsets.UTF_8);
        store.reload();
        assertEquals(ImmutableSet.of("bob"), store.usernames());
        assertEquals(Optional.empty(), store.getKey("alice"));
    }

    private Path write(String... lines) throws Exception
    {
        File file = folder.newFile();
        Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        return file.toPath();
    }
}

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
import java.util.HashSet;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import static org.apache.spamsig.auth.Account.ANONYMOUS_USER;
import static org.apache.spamsig.auth.Commands.CHECK;
import static org.apache.spamsig.auth.Commands.REPORT;
import static org.apache.spamsig.auth.Commands.WHITELIST;

public class AccessPolicyEngineTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void missingFileUsesDefaultPolicy() throws Exception
    {
        Path missing = folder.getRoot().toPath().resolve("does-not-exist");
        AccessPolicy acl = AccessPolicyEngine.loadRules(missing, ImmutableSet.of("alice"));

        assertSame(AccessPolicy.defaultPolicy(), acl);
        assertTrue(AccessPolicyEngine.query(acl, ANONYMOUS_USER, REPORT));
        assertFalse(AccessPolicyEngine.query(acl, ANONYMOUS_USER, WHITELIST));
        assertFalse(AccessPolicyEngine.query(acl, "alice", CHECK));
    }

    @Test
    public void nullFileUsesDefaultPolicy() throws Exception
    {
        assertSame(AccessPolicy.defaultPolicy(), AccessPolicyEngine.loadRules(null, ImmutableSet.of()));
    }

    @Test
    public void commentsBlankAndInvalidLinesAreSkipped() throws Exception
    {
        Path file = write("# a comment",
                          "",
                          "   ",
                          "all : bob : allow",
                          "onlyonepart",
                          "check : bob",
                          "report : bob : perhaps",
                          "report : bob : deny");
        AccessPolicy acl = AccessPolicyEngine.loadRules(file, ImmutableSet.of("bob"));

        assertFalse(AccessPolicyEngine.query(acl, "bob", REPORT));
        assertTrue(AccessPolicyEngine.query(acl, "bob", CHECK));
        assertEquals(ImmutableSet.of("bob"), acl.asMap().keySet());
    }

    @Test
    public void parseRulesKeepsFileOrder() throws Exception
    {
        ImmutableList<AccessRule> rules = AccessPolicyEngine.parseRules(Arrays.asList("check : a : allow",
                                                                                      "#check : b : allow",
                                                                                      "report : a : deny"));
        assertEquals(ImmutableList.of(AccessRule.parse("check : a : allow"), AccessRule.parse("report : a : deny")),
                     rules);
    }

    @Test
    public void deniesEverythingBeforeFirstReload() throws Exception
    {
        AccessPolicyEngine engine = new AccessPolicyEngine(write("all : all : allow"), () -> ImmutableSet.of("bob"));
        assertFalse(engine.isAllowed("bob", CHECK));

        engine.reload();
        assertTrue(engine.isAllowed("bob", CHECK));
    }

    @Test
    public void reloadSwapsInNewPolicy() throws Exception
    {
        Set<String> accounts = new HashSet<>(ImmutableSet.of("alice"));
        Path file = write("all : all : allow");
        AccessPolicyEngine engine = new AccessPolicyEngine(file, () -> ImmutableSet.copyOf(accounts));
        engine.reload();
        AccessPolicy before = engine.currentPolicy();
        assertTrue(engine.isAllowed("alice", WHITELIST));
        assertFalse(engine.isAllowed("bob", WHITELIST));

        // new account and a new rule, picked up only on reload
        accounts.add("bob");
        Files.write(file, Arrays.asList("all : all : allow", "whitelist : alice : deny"), StandardCharsets.UTF_8);
        assertTrue(engine.isAllowed("alice", WHITELIST));

        engine.reload();
        assertFalse(engine.isAllowed("alice", WHITELIST));
        assertTrue(engine.isAllowed("bob", WHITELIST));

        // the old policy object is untouched by the reload
        assertTrue(before.isAllowed("alice", WHITELIST));
        assertThat(before.asMap()).doesNotContainKey("bob");
    }

    private Path write(String... lines) throws Exception
    {
        File file = folder.newFile();
        Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        return file.toPath();
    }
}

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
/**
 * Who may talk to the server and what they may ask it to do.
 *
 * {@link org.apache.spamsig.auth.CredentialStore} holds the server's accounts, read from a file of
 * {@code username : key} lines. The keys are used to check request signatures.
 *
 * {@link org.apache.spamsig.auth.AccessPolicyEngine} reads the access file, a list of
 * {@link org.apache.spamsig.auth.AccessRule}s of the form {@code operations : users : allow|deny}, and
 * compiles it into an {@link org.apache.spamsig.auth.AccessPolicy}, the set of commands each user may
 * run. Rules are applied in file order, so for a given user and command the last matching line wins.
 * Users no rule grants anything to are denied everything, including the anonymous user unless named.
 *
 * {@link org.apache.spamsig.auth.AuthManager} combines the two for the request handling layer.
 *
 * {@link org.apache.spamsig.auth.ClientCredentials} is the client side counterpart of the credential
 * store, mapping each server's host and port to the {@link org.apache.spamsig.auth.Account} used with it.
 *
 * All loaded state is immutable and replaced as a whole on reload, so lookups need no locking.
 */
package org.apache.spamsig.auth;

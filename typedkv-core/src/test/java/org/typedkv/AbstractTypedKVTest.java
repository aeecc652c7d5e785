/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.typedkv;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;
import static org.testng.Assert.fail;

import com.google.protobuf.ByteString;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.SneakyThrows;
import org.testng.annotations.Test;
import org.typedkv.codec.KVCodecs;
import org.typedkv.exception.TypedKVException.DecodeException;
import org.typedkv.exception.TypedKVException.EncodeException;
import org.typedkv.exception.TypedKVException.StorageException;
import org.typedkv.exception.TypedKVException.UnabortableEncodingException;
import org.typedkv.localengine.IKVEngine;
import org.typedkv.localengine.KVEngineFactory;
import org.typedkv.localengine.MockableTest;

public abstract class AbstractTypedKVTest extends MockableTest {
    private static final KVSchema<String, Long> PEOPLE = KVSchema.of(KVCodecs.utf8(), KVCodecs.int64());
    private static final KVSchema<String, String> TEXT = KVSchema.of(KVCodecs.utf8(), KVCodecs.utf8());
    private static final KVSchema<Long, String> NUMBERED = KVSchema.of(KVCodecs.int64(), KVCodecs.utf8());
    private static final KVSchema<String, ByteString> RAW = KVSchema.of(KVCodecs.utf8(), KVCodecs.bytes());
    private static final KVSchema<Struct, String> TAGGED =
        KVSchema.of(KVCodecs.protobuf(Struct.parser()), KVCodecs.utf8());

    protected IKVEngine engine;

    @Override
    protected void doSetup(Method method) {
        beforeStart();
        engine = KVEngineFactory.create(engineType(), engineConf());
        engine.start("env", "test");
    }

    @Override
    protected void doTeardown(Method method) {
        engine.stop();
        afterStop();
    }

    protected void beforeStart() {
        // no-op
    }

    protected void afterStop() {
        // no-op
    }

    protected abstract String engineType();

    protected abstract Struct engineConf();

    @Test
    public void insertAndGet() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        assertEquals(people.name(), "people");
        assertFalse(people.insert("Paul", 32L).isPresent());
        assertEquals((long) people.insert("Paul", 33L).get().get(), 32L);
        assertEquals((long) people.get("Paul").get().get(), 33L);
        assertTrue(people.containsKey("Paul"));
        assertFalse(people.get("Adam").isPresent());
        assertFalse(people.containsKey("Adam"));
    }

    @Test
    public void openSameNameSharesData() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("Paul", 32L);
        TypedCollection<String, Long> again = TypedCollection.open(engine, "people", PEOPLE);
        assertEquals((long) again.get("Paul").get().get(), 32L);
        assertFalse(TypedCollection.open(engine, "others", PEOPLE).containsKey("Paul"));
    }

    @Test
    public void removeIsIdempotent() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("Jane", 28L);
        assertEquals((long) people.remove("Jane").get().get(), 28L);
        assertFalse(people.remove("Jane").isPresent());
        assertFalse(people.remove("Jane").isPresent());
        assertFalse(people.get("Jane").isPresent());
    }

    @Test
    public void iterationFollowsEncodedKeyOrder() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("Paul", 32L);
        people.insert("Adam", 41L);
        people.insert("Jane", 28L);
        assertEquals(keys(people.iter()), List.of("Adam", "Jane", "Paul"));

        TypedCollection<Long, String> numbered = TypedCollection.open(engine, "numbered", NUMBERED);
        for (long n : new long[] {10, -3, 0, Long.MIN_VALUE, 7}) {
            numbered.insert(n, Long.toString(n));
        }
        List<Long> ordered = new ArrayList<>();
        try (TypedIterator<Long, String> itr = numbered.iter()) {
            itr.keys().forEachRemaining(k -> ordered.add(k.get()));
        }
        assertEquals(ordered, List.of(Long.MIN_VALUE, -3L, 0L, 7L, 10L));
    }

    @Test
    public void emptyCollectionNameRejected() {
        IllegalArgumentException e = expectThrows(IllegalArgumentException.class,
            () -> TypedCollection.open(engine, "", PEOPLE));
        assertEquals(e.getMessage(), "Collection name must not be empty");
        assertThrows(IllegalArgumentException.class, () -> TypedCollection.open(engine, null, PEOPLE));
    }

    @Test
    public void equalMessageKeysFindSameEntry() {
        TypedCollection<Struct, String> tagged = TypedCollection.open(engine, "tagged", TAGGED);
        Value red = Value.newBuilder().setStringValue("red").build();
        Value big = Value.newBuilder().setStringValue("big").build();
        tagged.insert(Struct.newBuilder().putFields("color", red).putFields("size", big).build(), "first");
        Struct reordered = Struct.newBuilder().putFields("size", big).putFields("color", red).build();
        assertEquals(tagged.get(reordered).get().get(), "first");
        assertEquals(tagged.insert(reordered, "second").get().get(), "first");
        assertEquals(tagged.size(), 1);
    }

    @Test
    public void range() {
        TypedCollection<Long, String> numbered = TypedCollection.open(engine, "numbered", NUMBERED);
        for (long n = 1; n <= 5; n++) {
            numbered.insert(n, "n" + n);
        }
        assertEquals(longKeys(numbered.range(KeyRange.closed(2L, 4L))), List.of(2L, 3L, 4L));
        assertEquals(longKeys(numbered.range(KeyRange.closedOpen(2L, 4L))), List.of(2L, 3L));
        assertEquals(longKeys(numbered.range(KeyRange.openClosed(2L, 4L))), List.of(3L, 4L));
        assertEquals(longKeys(numbered.range(KeyRange.open(2L, 4L))), List.of(3L));
        assertEquals(longKeys(numbered.range(KeyRange.atLeast(4L))), List.of(4L, 5L));
        assertEquals(longKeys(numbered.range(KeyRange.greaterThan(4L))), List.of(5L));
        assertEquals(longKeys(numbered.range(KeyRange.atMost(2L))), List.of(1L, 2L));
        assertEquals(longKeys(numbered.range(KeyRange.lessThan(2L))), List.of(1L));
        assertEquals(longKeys(numbered.range(KeyRange.all())), List.of(1L, 2L, 3L, 4L, 5L));
        assertEquals(longKeys(numbered.range(KeyRange.open(3L, 3L))), List.of());
        assertEquals(longKeys(numbered.range(KeyRange.closed(4L, 2L))), List.of());
    }

    @Test
    public void rangeEndsAtExactKey() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("Jane", 1L);
        people.insert("Jane2", 2L);
        people.insert("Janet", 3L);
        assertEquals(keys(people.range(KeyRange.closed("Adam", "Jane"))), List.of("Jane"));
        assertEquals(keys(people.range(KeyRange.greaterThan("Jane"))), List.of("Jane2", "Janet"));
    }

    @Test
    public void scanPrefix() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("Jan", 1L);
        people.insert("Jane", 2L);
        people.insert("Janet", 3L);
        people.insert("Jo", 4L);
        people.insert("Ja", 5L);
        assertEquals(keys(people.scanPrefix("Jan")), List.of("Jan", "Jane", "Janet"));
        assertEquals(keys(people.scanPrefix("")), List.of("Ja", "Jan", "Jane", "Janet", "Jo"));
        assertEquals(keys(people.scanPrefix("K")), List.of());
    }

    @Test
    public void doubleEndedIteration() {
        TypedCollection<Long, String> numbered = TypedCollection.open(engine, "numbered", NUMBERED);
        for (long n = 1; n <= 5; n++) {
            numbered.insert(n, "n" + n);
        }
        try (TypedIterator<Long, String> itr = numbered.iter()) {
            assertEquals((long) itr.next().key(), 1L);
            assertEquals((long) itr.nextBack().key(), 5L);
            assertEquals((long) itr.nextBack().key(), 4L);
            assertTrue(itr.hasNext());
            assertTrue(itr.hasNextBack());
            assertEquals((long) itr.next().key(), 2L);
            assertEquals((long) itr.next().key(), 3L);
            assertFalse(itr.hasNext());
            assertFalse(itr.hasNextBack());
        }
        try (TypedIterator<Long, String> itr = numbered.iter()) {
            List<Long> backwards = new ArrayList<>();
            while (itr.hasNextBack()) {
                backwards.add(itr.nextBack().key());
            }
            assertEquals(backwards, List.of(5L, 4L, 3L, 2L, 1L));
            assertFalse(itr.hasNext());
        }
    }

    @Test
    public void doubleEndedIterationSharesLastElement() {
        TypedCollection<Long, String> numbered = TypedCollection.open(engine, "numbered", NUMBERED);
        numbered.insert(1L, "one");
        numbered.insert(2L, "two");
        try (TypedIterator<Long, String> itr = numbered.iter()) {
            assertTrue(itr.hasNext());
            assertTrue(itr.hasNextBack());
            assertEquals(itr.nextBack().value(), "two");
            assertTrue(itr.hasNextBack());
            assertEquals(itr.nextBack().value(), "one");
            assertFalse(itr.hasNext());
        }
        numbered.remove(2L);
        try (TypedIterator<Long, String> itr = numbered.iter()) {
            assertTrue(itr.hasNext());
            assertTrue(itr.hasNextBack());
            assertEquals((long) itr.nextBack().key(), 1L);
            assertFalse(itr.hasNext());
            assertThrows(NoSuchElementException.class, itr::next);
        }
    }

    @Test
    public void valuesProjection() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("Paul", 32L);
        people.insert("Adam", 41L);
        List<Long> ages = new ArrayList<>();
        try (DoubleEndedIterator<ValueView<Long>> values = people.iter().values()) {
            values.forEachRemaining(v -> ages.add(v.get()));
        }
        assertEquals(ages, List.of(41L, 32L));
    }

    @Test
    public void decodeFailureStaysInView() {
        TypedCollection<String, String> text = TypedCollection.open(engine, "shared", TEXT);
        text.insert("Paul", "not a number");
        TypedCollection<String, Long> people = TypedCollection.open(engine, "shared", PEOPLE);

        ValueView<Long> view = people.get("Paul").get();
        assertEquals(view.bytes(), ByteString.copyFromUtf8("not a number"));
        assertThrows(DecodeException.class, view::get);

        try (TypedIterator<String, Long> itr = people.iter()) {
            KeyValueView<String, Long> entry = itr.next();
            assertEquals(entry.key(), "Paul");
            assertThrows(DecodeException.class, entry::value);
        }
        try (DoubleEndedIterator<KeyView<String>> keys = people.iter().keys()) {
            assertEquals(keys.next().get(), "Paul");
        }
    }

    @Test
    public void viewKeepsDecodedBuffer() {
        TypedCollection<String, ByteString> raw = TypedCollection.open(engine, "raw", RAW);
        ByteString payload = ByteString.copyFromUtf8("payload");
        raw.insert("k", payload);
        ValueView<ByteString> view = raw.get("k").get();
        raw.insert("k", ByteString.copyFromUtf8("changed"));
        raw.clear();
        assertEquals(view.get(), payload);
        assertEquals(view.get(), view.bytes());
    }

    @Test
    public void encodeFailureBeforeStorage() {
        TypedCollection<String, String> text = TypedCollection.open(engine, "text", TEXT);
        assertThrows(EncodeException.class, () -> text.insert("k", "bad\uD800"));
        assertThrows(EncodeException.class, () -> text.get("bad\uDC00"));
        assertTrue(text.isEmpty());
    }

    @Test
    public void applyBatch() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("Adam", 41L);
        TypedBatch<String, Long> batch = people.newBatch()
            .insert("Paul", 32L)
            .insert("Jane", 28L)
            .remove("Adam")
            .insert("Paul", 33L);
        assertEquals(batch.size(), 4);
        assertEquals(people.size(), 1);

        people.applyBatch(batch);
        assertEquals(keys(people.iter()), List.of("Jane", "Paul"));
        assertEquals((long) people.get("Paul").get().get(), 33L);

        assertThrows(IllegalStateException.class, () -> people.applyBatch(batch));
        assertThrows(IllegalStateException.class, () -> batch.insert("Adam", 1L));
    }

    @Test
    public void batchEncodeFailureAtStaging() {
        TypedCollection<String, String> text = TypedCollection.open(engine, "text", TEXT);
        TypedBatch<String, String> batch = new TypedBatch<>(TEXT).insert("a", "1");
        assertThrows(EncodeException.class, () -> batch.insert("b", "bad\uD800"));
        assertEquals(batch.size(), 1);
        text.applyBatch(batch);
        assertEquals(text.size(), 1);
    }

    @Test
    public void batchOfOtherSchemaRejected() {
        TypedCollection<String, String> text = TypedCollection.open(engine, "text", TEXT);
        TypedBatch<String, String> batch = new TypedBatch<>(KVSchema.of(KVCodecs.utf8(), KVCodecs.utf8()));
        assertThrows(IllegalArgumentException.class, () -> text.applyBatch(batch.insert("a", "1")));
        assertTrue(text.isEmpty());
    }

    @Test
    public void popMinAndMax() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        assertFalse(people.popMin().isPresent());
        assertFalse(people.popMax().isPresent());
        people.insert("Paul", 32L);
        people.insert("Adam", 41L);
        people.insert("Jane", 28L);

        KeyValueView<String, Long> min = people.popMin().get();
        assertEquals(min.key(), "Adam");
        assertEquals((long) min.value(), 41L);
        KeyValueView<String, Long> max = people.popMax().get();
        assertEquals(max.key(), "Paul");
        assertEquals(people.size(), 1);
        assertEquals(people.popMax().get().key(), "Jane");
        assertTrue(people.isEmpty());
    }

    @Test
    public void sizeAndClear() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        assertTrue(people.isEmpty());
        assertEquals(people.size(), 0);
        people.insert("Paul", 32L);
        people.insert("Adam", 41L);
        assertFalse(people.isEmpty());
        assertEquals(people.size(), 2);
        people.clear();
        assertTrue(people.isEmpty());
        assertFalse(people.get("Paul").isPresent());
    }

    @Test
    public void flushAsync() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("Paul", 32L);
        people.flushAsync().join();
        List<CompletableFuture<Void>> flushes = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            flushes.add(people.flushAsync());
        }
        flushes.forEach(CompletableFuture::join);
        assertEquals((long) people.get("Paul").get().get(), 32L);
    }

    @Test
    public void stoppedEngineIsStorageFailure() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        engine.stop();
        assertThrows(StorageException.class, () -> TypedCollection.open(engine, "other", PEOPLE));
        assertThrows(StorageException.class, () -> people.get("Paul"));
        engine = KVEngineFactory.create(engineType(), engineConf());
        engine.start();
    }

    @Test
    public void transactionAcrossThreeCollections() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        TypedCollection<String, String> text = TypedCollection.open(engine, "text", TEXT);
        TypedCollection<Long, String> numbered = TypedCollection.open(engine, "numbered", NUMBERED);

        String result = TransactionComposer.join(people, text, numbered).<String, RuntimeException>transact(views -> {
            assertEquals(views.size(), 3);
            assertEquals(views.get(1).name(), "text");
            views.of(people).insert("Paul", 32L);
            views.of(text).insert("Paul", "builder");
            views.of(numbered).insert(32L, "Paul");
            return "done";
        });
        assertEquals(result, "done");
        assertEquals((long) people.get("Paul").get().get(), 32L);
        assertEquals(text.get("Paul").get().get(), "builder");
        assertEquals(numbered.get(32L).get().get(), "Paul");
    }

    @Test
    public void abortDiscardsEverything() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        TypedCollection<String, String> text = TypedCollection.open(engine, "text", TEXT);
        TypedCollection<Long, String> numbered = TypedCollection.open(engine, "numbered", NUMBERED);
        people.insert("Adam", 41L);

        AtomicInteger invocations = new AtomicInteger();
        Exception abort = expectThrows(Exception.class, () ->
            TransactionComposer.join(people, text, numbered).transact(views -> {
                invocations.incrementAndGet();
                views.of(people).insert("Paul", 32L);
                views.of(people).remove("Adam");
                views.of(text).insert("Paul", "builder");
                views.of(numbered).insert(32L, "Paul");
                throw new Exception("abort");
            }));
        assertEquals(abort.getMessage(), "abort");
        assertEquals(invocations.get(), 1);
        assertEquals(keys(people.iter()), List.of("Adam"));
        assertTrue(text.isEmpty());
        assertTrue(numbered.isEmpty());
    }

    @Test
    public void readYourWrites() throws Exception {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("Adam", 41L);
        people.transaction(tx -> {
            assertFalse(tx.get("Paul").isPresent());
            assertFalse(tx.insert("Paul", 32L).isPresent());
            assertEquals((long) tx.get("Paul").get().get(), 32L);
            assertFalse(people.containsKey("Paul"));
            assertEquals((long) tx.remove("Adam").get().get(), 41L);
            assertFalse(tx.containsKey("Adam"));
            assertTrue(people.containsKey("Adam"));
            return null;
        });
        assertEquals((long) people.get("Paul").get().get(), 32L);
        assertFalse(people.containsKey("Adam"));
    }

    @Test
    public void conflictRetriesCallback() throws Exception {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("counter", 0L);
        AtomicInteger invocations = new AtomicInteger();
        long committed = people.transaction(tx -> {
            long current = tx.get("counter").get().get();
            if (invocations.incrementAndGet() == 1) {
                // a concurrent writer gets in between the read and the commit
                people.insert("counter", 100L);
            }
            tx.insert("counter", current + 1);
            return current + 1;
        });
        assertEquals(invocations.get(), 2);
        assertEquals(committed, 101L);
        assertEquals((long) people.get("counter").get().get(), 101L);
    }

    @SneakyThrows
    @Test
    public void concurrentIncrementsAreSerialized() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("counter", 0L);
        int threads = 4;
        int rounds = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        people.<Void, RuntimeException>transaction(tx -> {
                            tx.insert("counter", tx.get("counter").get().get() + 1);
                            return null;
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals((long) people.get("counter").get().get(), (long) threads * rounds);
    }

    @Test
    public void unabortableEncodingRollsBack() {
        TypedCollection<String, String> text = TypedCollection.open(engine, "text", TEXT);
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        AtomicInteger invocations = new AtomicInteger();
        UnabortableEncodingException e = expectThrows(UnabortableEncodingException.class, () ->
            TransactionComposer.join(text, people).<Void, RuntimeException>transact(views -> {
                invocations.incrementAndGet();
                views.of(people).insert("Paul", 32L);
                views.of(text).insert("Paul", "bad\uD800");
                fail("encoding must fail");
                return null;
            }));
        assertTrue(e.getCause() instanceof EncodeException);
        assertEquals(invocations.get(), 1);
        assertTrue(text.isEmpty());
        assertTrue(people.isEmpty());
    }

    @Test
    public void unabortableEncodingEscapesDomainChannel() {
        TypedCollection<String, String> text = TypedCollection.open(engine, "text", TEXT);
        assertThrows(UnabortableEncodingException.class, () -> text.transaction(tx -> {
            try {
                tx.get("bad\uDC00");
            } catch (EncodeException wrongType) {
                fail("must not surface as a plain encode failure");
            }
            return null;
        }));
    }

    @Test
    public void viewUnusableAfterAttempt() throws Exception {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        AtomicReference<TransactionalCollection<String, Long>> leaked = new AtomicReference<>();
        people.transaction(tx -> {
            leaked.set(tx);
            tx.insert("Paul", 32L);
            return null;
        });
        assertThrows(IllegalStateException.class, () -> leaked.get().get("Paul"));
        assertThrows(IllegalStateException.class, () -> leaked.get().insert("Adam", 1L));
        assertThrows(IllegalStateException.class, () -> leaked.get().flush());
        assertThrows(IllegalStateException.class, () -> leaked.get().generateId());
        assertEquals((long) people.get("Paul").get().get(), 32L);
    }

    @Test
    public void transactionalBatchIsReusable() throws Exception {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.insert("counter", 0L);
        TypedBatch<String, Long> batch = people.newBatch().insert("Paul", 32L).insert("Jane", 28L).remove("Adam");
        AtomicInteger invocations = new AtomicInteger();
        people.transaction(tx -> {
            tx.get("counter");
            tx.applyBatch(batch);
            assertEquals((long) tx.get("Jane").get().get(), 28L);
            if (invocations.incrementAndGet() == 1) {
                people.insert("counter", 1L);
            }
            return null;
        });
        assertEquals(invocations.get(), 2);
        assertEquals(keys(people.iter()), List.of("Jane", "Paul", "counter"));
        assertEquals(batch.size(), 3);
        people.applyBatch(batch);
    }

    @Test
    public void generatedIdsAreMonotonic() throws Exception {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        TypedCollection<String, String> text = TypedCollection.open(engine, "text", TEXT);
        List<Long> ids = TransactionComposer.join(people, text).<List<Long>, RuntimeException>transact(views -> {
            List<Long> generated = new ArrayList<>();
            generated.add(views.of(people).generateId());
            generated.add(views.of(text).generateId());
            generated.add(views.generateId());
            return generated;
        });
        assertTrue(ids.get(0) < ids.get(1));
        assertTrue(ids.get(1) < ids.get(2));
        long next = people.transaction(TransactionalCollection::generateId);
        assertTrue(ids.get(2) < next);
    }

    @Test
    public void flushInsideTransaction() throws Exception {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        people.transaction(tx -> {
            tx.insert("Paul", 32L);
            tx.flush();
            return null;
        });
        people.flushAsync().join();
        assertEquals((long) people.get("Paul").get().get(), 32L);
    }

    @Test
    public void joinRejectsDuplicates() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        TypedCollection<String, Long> sameName = TypedCollection.open(engine, "people", PEOPLE);
        assertThrows(IllegalArgumentException.class, () -> TransactionComposer.join(people, people));
        assertThrows(IllegalArgumentException.class, () -> TransactionComposer.join(people, sameName));
        assertEquals(TransactionComposer.join(people).size(), 1);
    }

    @Test
    public void unjoinedCollectionRejected() {
        TypedCollection<String, Long> people = TypedCollection.open(engine, "people", PEOPLE);
        TypedCollection<String, String> text = TypedCollection.open(engine, "text", TEXT);
        assertThrows(IllegalArgumentException.class, () -> TransactionComposer.join(people)
            .<Void, RuntimeException>transact(views -> {
                views.of(text);
                return null;
            }));
    }

    private static List<String> keys(TypedIterator<String, ?> itr) {
        List<String> keys = new ArrayList<>();
        try (itr) {
            itr.forEachRemaining(kv -> keys.add(kv.key()));
        }
        return keys;
    }

    private static List<Long> longKeys(TypedIterator<Long, ?> itr) {
        List<Long> keys = new ArrayList<>();
        try (itr) {
            itr.forEachRemaining(kv -> keys.add(kv.key()));
        }
        return keys;
    }
}

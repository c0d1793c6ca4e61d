package com.featureprobe.sdk.server;

import org.junit.Test;

import static com.featureprobe.sdk.server.TestUtil.fixtureRepo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class RepositoryStoreTest {
  private final RepositoryStore store = new RepositoryStore();

  @Test
  public void startsEmptyAndUninitialized() {
    assertTrue(store.get().isEmpty());
    assertFalse(store.isInitialized());
  }

  @Test
  public void initReplacesSnapshot() {
    Repository repo = fixtureRepo();
    store.init(repo);
    assertSame(repo, store.get());
    assertTrue(store.isInitialized());

    Repository next = fixtureRepo();
    store.init(next);
    assertSame(next, store.get());
  }

  @Test
  public void initWithNullPublishesEmptySnapshot() {
    store.init(fixtureRepo());
    store.init(null);
    assertSame(Repository.empty(), store.get());
    assertTrue(store.isInitialized());
  }

  @Test
  public void clearDropsData() {
    store.init(fixtureRepo());
    store.clear();
    assertTrue(store.get().isEmpty());
  }
}

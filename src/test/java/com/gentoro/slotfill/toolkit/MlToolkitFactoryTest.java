package com.gentoro.slotfill.toolkit;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.slotfill.ExtractorConfig;
import com.gentoro.slotfill.exception.ConfigException;
import com.gentoro.slotfill.testing.FakeCrfBackend;
import com.gentoro.slotfill.testing.FakeEmbeddingBackend;
import com.gentoro.slotfill.toolkit.crfsuite.CrfSuiteBackend;
import com.gentoro.slotfill.toolkit.fasttext.FastTextEmbeddingBackend;
import org.junit.jupiter.api.Test;

class MlToolkitFactoryTest {

  @Test
  void resolvesRegisteredProviders() {
    MlToolkit fake =
        MlToolkitFactory.create(ExtractorConfig.builder().toolkitProvider("fake").build());
    assertInstanceOf(FakeEmbeddingBackend.class, fake.embeddings());
    assertInstanceOf(FakeCrfBackend.class, fake.crf());

    MlToolkit nativeToolkit = MlToolkitFactory.create(ExtractorConfig.defaults());
    assertInstanceOf(FastTextEmbeddingBackend.class, nativeToolkit.embeddings());
    assertInstanceOf(CrfSuiteBackend.class, nativeToolkit.crf());
  }

  @Test
  void unknownProviderListsAvailableOnes() {
    ConfigException ex =
        assertThrows(
            ConfigException.class,
            () ->
                MlToolkitFactory.create(
                    ExtractorConfig.builder().toolkitProvider("tensorflow").build()));
    assertTrue(ex.getMessage().contains("tensorflow"));
    assertTrue(ex.getMessage().contains("native"));
    assertTrue(ex.getMessage().contains("fake"));
  }
}

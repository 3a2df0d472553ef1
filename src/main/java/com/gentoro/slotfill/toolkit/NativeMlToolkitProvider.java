package com.gentoro.slotfill.toolkit;

import com.gentoro.slotfill.ExtractorConfig;
import com.gentoro.slotfill.toolkit.crfsuite.CrfSuiteBackend;
import com.gentoro.slotfill.toolkit.fasttext.FastTextEmbeddingBackend;

/** fastText embeddings and CRFsuite tagging through their JNI bindings. */
public class NativeMlToolkitProvider implements MlToolkitProvider {
  public static final String ID = "native";

  @Override
  public String providerId() {
    return ID;
  }

  @Override
  public MlToolkit create(ExtractorConfig config) {
    return new DefaultMlToolkit(new FastTextEmbeddingBackend(), new CrfSuiteBackend());
  }
}

package com.gentoro.slotfill.cluster;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.slotfill.exception.TrainingException;
import com.gentoro.slotfill.exception.ValidationException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClusterModelTest {

  private static final List<double[]> TWO_BLOBS =
      List.of(
          new double[] {0, 0}, new double[] {0, 1}, new double[] {1, 0},
          new double[] {10, 10}, new double[] {10, 11}, new double[] {11, 10});

  @Test
  void separatesWellSeparatedGroups() {
    ClusterModel model = ClusterModel.fit(TWO_BLOBS, new ClusterParams(2, 100, 1L));

    assertEquals(2, model.size());
    int low = model.nearestCluster(new double[] {0.3, 0.3});
    int high = model.nearestCluster(new double[] {10.3, 10.3});
    assertNotEquals(low, high);
    assertEquals(low, model.nearestCluster(new double[] {1, 1}));
    assertEquals(high, model.nearestCluster(new double[] {9, 9}));
  }

  @Test
  @DisplayName("Fewer distinct vectors than clusters fails, duplicates count once")
  void tooFewDistinctVectors() {
    List<double[]> vectors =
        List.of(new double[] {1, 1}, new double[] {1, 1}, new double[] {2, 2});

    TrainingException ex =
        assertThrows(
            TrainingException.class, () -> ClusterModel.fit(vectors, new ClusterParams(3, 10, 1L)));
    assertEquals(2, ex.getContext().get("distinctPoints"));
    assertEquals(3, ex.getContext().get("clusters"));
  }

  @Test
  void sameSeedSameAssignment() {
    ClusterModel a = ClusterModel.fit(TWO_BLOBS, new ClusterParams(3, 100, 9L));
    ClusterModel b = ClusterModel.fit(TWO_BLOBS, new ClusterParams(3, 100, 9L));
    for (double[] v : TWO_BLOBS) {
      assertEquals(a.nearestCluster(v), b.nearestCluster(v));
    }
  }

  @Test
  void dimensionMismatchIsRejected() {
    ClusterModel model = ClusterModel.fit(TWO_BLOBS, new ClusterParams(2, 100, 1L));
    assertThrows(ValidationException.class, () -> model.nearestCluster(new double[] {1, 2, 3}));
  }
}

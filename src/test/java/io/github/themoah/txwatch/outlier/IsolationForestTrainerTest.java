package io.github.themoah.txwatch.outlier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.txwatch.config.ModelConfig;
import io.github.themoah.txwatch.model.FeatureVector;
import io.github.themoah.txwatch.model.OutlierScore;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for IsolationForestTrainer.
 */
public class IsolationForestTrainerTest {

  private static final ModelConfig CONFIG = new ModelConfig(true, 100, 256, 24, 0.05, 0.55);

  private static List<FeatureVector> normalWindows(int n) {
    Random random = new Random(42);
    List<FeatureVector> vectors = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      long total = 100 + random.nextInt(11) - 5;
      long bad = 4 + random.nextInt(3);
      double delta = random.nextInt(11) - 5;
      double deltaRate = (random.nextDouble() - 0.5) * 0.02;
      vectors.add(new FeatureVector(total, bad, (double) bad / total, delta, deltaRate));
    }
    return vectors;
  }

  @Test
  void tooFewVectors_throws() {
    IsolationForestTrainer trainer = new IsolationForestTrainer(CONFIG);

    assertThrows(IllegalArgumentException.class, () -> trainer.fit(normalWindows(10)));
  }

  @Test
  void separatedWindow_scoresHigherAndIsFlagged() {
    IsolationForestTrainer trainer = new IsolationForestTrainer(CONFIG);
    OutlierModel model = trainer.fit(normalWindows(200));

    FeatureVector typical = new FeatureVector(100, 5, 0.05, 0, 0);
    FeatureVector outlier = new FeatureVector(1000, 500, 0.5, 900, 0.45);

    OutlierScore typicalScore = model.score(typical);
    OutlierScore outlierScore = model.score(outlier);

    assertEquals(OutlierScore.Status.SCORED, outlierScore.status());
    assertTrue(outlierScore.score() > typicalScore.score(),
      "outlier " + outlierScore.score() + " vs typical " + typicalScore.score());
    assertTrue(outlierScore.anomalous());
    assertEquals(200, model.trainedRows());
  }

  @Test
  void threshold_neverBelowFloor() {
    IsolationForestModel model = (IsolationForestModel) new IsolationForestTrainer(CONFIG).fit(normalWindows(50));

    assertTrue(model.threshold() >= CONFIG.scoreFloor());
    assertTrue(model.describe().contains("50 rows"));
  }

  @Test
  void scoring_isDeterministicForATrainedModel() {
    OutlierModel model = new IsolationForestTrainer(CONFIG).fit(normalWindows(60));
    FeatureVector vector = new FeatureVector(120, 30, 0.25, 20, 0.2);

    double first = model.score(vector).score();
    for (int i = 0; i < 20; i++) {
      assertEquals(first, model.score(vector).score(), 0.0);
    }
  }
}

package com.z254.arbiter.model;

import com.z254.arbiter.domain.exception.ModelInferenceException;
import com.z254.arbiter.domain.exception.ModelTrainingException;
import com.z254.arbiter.domain.model.Decision;
import com.z254.arbiter.domain.model.ModelType;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.AbstractClassifier;
import weka.classifiers.trees.HoeffdingTree;
import weka.core.Instances;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Incremental learner backed by Weka's {@link HoeffdingTree}.
 * <p>
 * A single writer mutates the working tree under a lock and then publishes a
 * deep copy. Readers only ever touch the published copy, so a prediction
 * never observes a half-applied update.
 */
@Slf4j
public class HoeffdingTreeLearner implements OnlineGovernanceModel {

    private final String versionId;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Instances header = WekaSchema.emptyDataset(0);
    private final AtomicReference<HoeffdingTree> published = new AtomicReference<>();
    private final AtomicLong samplesSeen = new AtomicLong();
    private final AtomicLong updates = new AtomicLong();

    private HoeffdingTree working;

    private HoeffdingTreeLearner(String versionId) {
        this.versionId = versionId;
    }

    /**
     * Learner with no examples yet. Predictions fail until the first update.
     */
    public static HoeffdingTreeLearner fresh(String versionId) {
        return new HoeffdingTreeLearner(versionId);
    }

    /**
     * Learner built from an initial batch, e.g. synthetic warm-start samples.
     */
    public static HoeffdingTreeLearner warmStarted(String versionId, List<LabeledSample> samples) {
        HoeffdingTreeLearner learner = new HoeffdingTreeLearner(versionId);
        if (!samples.isEmpty()) {
            learner.initialize(WekaSchema.dataset(samples));
        }
        return learner;
    }

    @Override
    public String versionId() {
        return versionId;
    }

    @Override
    public ModelType modelType() {
        return ModelType.ONLINE_LEARNER;
    }

    @Override
    public double[] predictProba(double[] features) {
        HoeffdingTree snapshot = published.get();
        if (snapshot == null) {
            throw new ModelInferenceException("Online learner " + versionId + " has not seen any examples");
        }
        try {
            return snapshot.distributionForInstance(WekaSchema.unlabeled(features, header));
        } catch (Exception e) {
            throw new ModelInferenceException("Inference failed for " + versionId, e);
        }
    }

    @Override
    public void learnOne(double[] features, Decision label) {
        writeLock.lock();
        try {
            if (working == null) {
                Instances first = WekaSchema.emptyDataset(1);
                first.add(WekaSchema.labeled(features, label, first));
                initialize(first);
            } else {
                working.updateClassifier(WekaSchema.labeled(features, label, header));
                samplesSeen.incrementAndGet();
                publish();
            }
            updates.incrementAndGet();
        } catch (ModelTrainingException e) {
            throw e;
        } catch (Exception e) {
            throw new ModelTrainingException("Online update failed for " + versionId, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public long samplesSeen() {
        return samplesSeen.get();
    }

    @Override
    public long updateCount() {
        return updates.get();
    }

    private void initialize(Instances data) {
        writeLock.lock();
        try {
            HoeffdingTree tree = new HoeffdingTree();
            tree.buildClassifier(data);
            working = tree;
            samplesSeen.addAndGet(data.numInstances());
            publish();
            log.debug("Initialized online learner {} with {} examples", versionId, data.numInstances());
        } catch (Exception e) {
            throw new ModelTrainingException("Failed to initialize online learner " + versionId, e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Readers score against an immutable snapshot. {@code makeCopy} serializes
     * the whole tree, so every update costs time proportional to tree size;
     * corrections arrive at reviewer pace, far below that cost.
     */
    private void publish() throws Exception {
        published.set((HoeffdingTree) AbstractClassifier.makeCopy(working));
    }
}

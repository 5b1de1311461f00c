package com.powerguard.anomaly.engine.detector.autoencoder;

import java.util.Arrays;
import java.util.Random;

/**
 * Symmetric fully connected autoencoder: input, hidden, encoding, hidden, input.
 * Hidden layers use tanh, the output layer is linear. Trained with mini-batch Adam on mean squared error.
 */
public class Autoencoder {

    private static final double BETA1 = 0.9;
    private static final double BETA2 = 0.999;
    private static final double EPSILON = 1e-8;

    private final Layer[] layers;
    private long step;

    public Autoencoder(int inputDim, int hiddenDim, int encodingDim, long seed) {
        if (inputDim < 1 || hiddenDim < 1 || encodingDim < 1) {
            throw new IllegalArgumentException("Layer sizes must be positive");
        }
        Random random = new Random(seed);
        this.layers = new Layer[] {
                new Layer(inputDim, hiddenDim, true, random),
                new Layer(hiddenDim, encodingDim, true, random),
                new Layer(encodingDim, hiddenDim, true, random),
                new Layer(hiddenDim, inputDim, false, random)
        };
    }

    /**
     * Train on already-scaled rows. Row order is reshuffled every epoch from the given seed.
     *
     * @return mean training loss of the final epoch
     */
    public double train(double[][] data, int epochs, int batchSize, double learningRate, long shuffleSeed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train on zero rows");
        }
        Random random = new Random(shuffleSeed);
        int[] order = new int[data.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        int effectiveBatch = Math.max(1, Math.min(batchSize, data.length));

        double epochLoss = 0.0;
        for (int epoch = 0; epoch < epochs; epoch++) {
            shuffle(order, random);
            epochLoss = 0.0;
            for (int start = 0; start < order.length; start += effectiveBatch) {
                int end = Math.min(start + effectiveBatch, order.length);
                for (Layer layer : layers) layer.zeroGradients();
                for (int k = start; k < end; k++) {
                    epochLoss += backpropagate(data[order[k]], end - start);
                }
                step++;
                for (Layer layer : layers) layer.adamUpdate(learningRate, step);
            }
            epochLoss /= data.length;
        }
        return epochLoss;
    }

    public double[] reconstruct(double[] input) {
        double[] activation = input;
        for (Layer layer : layers) {
            activation = layer.forward(activation);
        }
        return activation;
    }

    /**
     * Mean squared difference between the input and its reconstruction.
     */
    public double reconstructionError(double[] input) {
        double[] output = reconstruct(input);
        double sum = 0.0;
        for (int j = 0; j < input.length; j++) {
            double d = output[j] - input[j];
            sum += d * d;
        }
        return sum / input.length;
    }

    // Accumulates gradients of one sample, scaled by 1/batch. Returns the sample loss.
    private double backpropagate(double[] input, int batch) {
        double[][] activations = new double[layers.length + 1][];
        activations[0] = input;
        for (int l = 0; l < layers.length; l++) {
            activations[l + 1] = layers[l].forward(activations[l]);
        }

        double[] output = activations[layers.length];
        double[] delta = new double[output.length];
        double loss = 0.0;
        for (int j = 0; j < output.length; j++) {
            double diff = output[j] - input[j];
            loss += diff * diff;
            delta[j] = 2.0 * diff / output.length / batch;
        }

        for (int l = layers.length - 1; l >= 0; l--) {
            delta = layers[l].backward(activations[l], activations[l + 1], delta);
        }
        return loss / output.length;
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }

    private static final class Layer {
        final int in;
        final int out;
        final boolean tanh;
        final double[][] weights;
        final double[] bias;
        final double[][] gradW;
        final double[] gradB;
        final double[][] mW, vW;
        final double[] mB, vB;

        Layer(int in, int out, boolean tanh, Random random) {
            this.in = in;
            this.out = out;
            this.tanh = tanh;
            this.weights = new double[out][in];
            this.bias = new double[out];
            this.gradW = new double[out][in];
            this.gradB = new double[out];
            this.mW = new double[out][in];
            this.vW = new double[out][in];
            this.mB = new double[out];
            this.vB = new double[out];
            // Xavier uniform
            double limit = Math.sqrt(6.0 / (in + out));
            for (int o = 0; o < out; o++) {
                for (int i = 0; i < in; i++) {
                    weights[o][i] = (random.nextDouble() * 2.0 - 1.0) * limit;
                }
            }
        }

        double[] forward(double[] x) {
            double[] y = new double[out];
            for (int o = 0; o < out; o++) {
                double z = bias[o];
                for (int i = 0; i < in; i++) z += weights[o][i] * x[i];
                y[o] = tanh ? Math.tanh(z) : z;
            }
            return y;
        }

        // delta is dLoss/dOutput of this layer; returns dLoss/dInput.
        double[] backward(double[] x, double[] y, double[] delta) {
            double[] dz = new double[out];
            for (int o = 0; o < out; o++) {
                dz[o] = tanh ? delta[o] * (1.0 - y[o] * y[o]) : delta[o];
            }
            double[] dx = new double[in];
            for (int o = 0; o < out; o++) {
                gradB[o] += dz[o];
                for (int i = 0; i < in; i++) {
                    gradW[o][i] += dz[o] * x[i];
                    dx[i] += weights[o][i] * dz[o];
                }
            }
            return dx;
        }

        void zeroGradients() {
            for (int o = 0; o < out; o++) {
                gradB[o] = 0.0;
                Arrays.fill(gradW[o], 0.0);
            }
        }

        void adamUpdate(double lr, long t) {
            double c1 = 1.0 - Math.pow(BETA1, t);
            double c2 = 1.0 - Math.pow(BETA2, t);
            for (int o = 0; o < out; o++) {
                for (int i = 0; i < in; i++) {
                    double g = gradW[o][i];
                    mW[o][i] = BETA1 * mW[o][i] + (1 - BETA1) * g;
                    vW[o][i] = BETA2 * vW[o][i] + (1 - BETA2) * g * g;
                    weights[o][i] -= lr * (mW[o][i] / c1) / (Math.sqrt(vW[o][i] / c2) + EPSILON);
                }
                double g = gradB[o];
                mB[o] = BETA1 * mB[o] + (1 - BETA1) * g;
                vB[o] = BETA2 * vB[o] + (1 - BETA2) * g * g;
                bias[o] -= lr * (mB[o] / c1) / (Math.sqrt(vB[o] / c2) + EPSILON);
            }
        }
    }
}

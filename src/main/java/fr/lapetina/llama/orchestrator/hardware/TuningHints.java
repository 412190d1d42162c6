package fr.lapetina.llama.orchestrator.hardware;

/**
 * Runtime settings suggested for a backend on this host.
 *
 * @param gpuLayers   layers to offload, -1 for all, 0 for none
 * @param threads     CPU threads, 0 lets the server decide
 * @param batchSize   prompt processing batch size
 * @param accelerated whether the backend runs on an accelerator
 */
public record TuningHints(int gpuLayers, int threads, int batchSize, boolean accelerated) {
}

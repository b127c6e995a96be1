package ai.pyflow.io;

import ai.pyflow.graph.Graph;

/**
 * Turns the finished graph into a diagram and a textual graph description.
 * Called once per run with the complete graph.
 */
public interface Renderer {

    RenderResult render(Graph graph) throws RendererException;
}

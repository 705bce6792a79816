package beambench.physics.solver;

import beambench.domain.bearing.BearingElement;
import beambench.domain.bearing.StressPoint;

import java.util.List;

public interface BallStressFieldGenerator extends SolverComponent {
    /**
     * Genera una nube de puntos interiores de la bola con la tensión interpolada.
     * Sólo sirve para el renderizado; no realimenta al solver.
     */
    List<StressPoint> generate(BearingElement element, int resolution);
}

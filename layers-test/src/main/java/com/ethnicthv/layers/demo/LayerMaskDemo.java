package com.ethnicthv.layers.demo;

import com.ethnicthv.layers.Layer;
import com.ethnicthv.layers.Mask;

import java.io.PrintStream;
import java.util.List;

/**
 * Demo for Mask algebra and the contains()/is() queries against host objects
 */
public class LayerMaskDemo {

    static final int FLOOR = 11;
    static final int PLAYER = 12;
    static final int WALL = 13;

    public static void main(String[] args) {
        run(System.out);
    }

    static void run(PrintStream out) {
        out.println("=== LayerMaskDemo ===\n");

        List<SceneObject> scene = List.of(
                new SceneObject("ground", FLOOR),
                new SceneObject("hero", PLAYER),
                new SceneObject("north-wall", WALL),
                new SceneObject("lake", Layer.WATER),
                new SceneObject("menu", Layer.UI),
                new SceneObject("crate", Layer.CLICKABLES)
        );

        Mask occupied = SceneQuery.occupied(scene);
        out.println("Occupied layers: " + occupied);

        // Everything a ray can hit: not UI, not explicitly ignored
        Mask raycastTargets = Mask.ALL_LAYERS.minus(Layer.UI, Layer.IGNORE_RAYCAST);
        out.println("Raycast hits:");
        new SceneQuery(scene)
                .in(raycastTargets)
                .notIn(Layer.WATER)
                .forEach(o -> out.printf("  %s%n", o.getName()));

        Mask walkable = Mask.of(FLOOR).or(Layer.WATER);
        Mask blocking = Mask.of(WALL, PLAYER);
        out.printf("walkable=%s blocking=%s overlap=%b%n",
                walkable, blocking, walkable.intersects(blocking));

        Mask hero = Mask.fromLayer(PLAYER);
        out.printf("hero contains PLAYER: %b, hero is PLAYER: %b, blocking is PLAYER: %b%n",
                hero.contains(PLAYER), hero.is(PLAYER), blocking.is(PLAYER));
        out.printf("blocking contains only WALL+PLAYER: %b, contains none of walkable: %b%n",
                blocking.contains().only(WALL, PLAYER), blocking.contains().none(walkable));

        out.println("\n=== Demo complete ===");
    }
}

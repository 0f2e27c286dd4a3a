package pass;

public interface Pass {
    // just a mark interface, concrete pass families are nested below

    interface GraphPass extends Pass {
        GraphPassType getType();

        /**
         * Run on one build. All state a pass needs lives in the context, so the same pass
         * instance is never shared between builds.
         */
        void run(BuildContext context);
    }
}

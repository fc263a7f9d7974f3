package com.docflow.engine.step;

import com.docflow.engine.EngineConfig;
import com.docflow.observability.HookDispatcher;

/**
 * Shared context for step handlers: provider invoker, sub-flow runner, hooks and engine config.
 */
public final class HandlerContext {

    private final ProviderStepInvoker providerInvoker;
    private final SubFlowRunner subFlowRunner;
    private final HookDispatcher hooks;
    private final EngineConfig config;

    public HandlerContext(ProviderStepInvoker providerInvoker, SubFlowRunner subFlowRunner,
                          HookDispatcher hooks, EngineConfig config) {
        this.providerInvoker = providerInvoker;
        this.subFlowRunner = subFlowRunner;
        this.hooks = hooks != null ? hooks : HookDispatcher.noop();
        this.config = config != null ? config : EngineConfig.defaults();
    }

    public ProviderStepInvoker getProviderInvoker() { return providerInvoker; }
    public SubFlowRunner getSubFlowRunner() { return subFlowRunner; }
    public HookDispatcher getHooks() { return hooks; }
    public EngineConfig getConfig() { return config; }
}

package org.lokray.eqcfg.emit;

import org.lokray.eqcfg.semantic.scope.ConnectionLink;
import org.lokray.eqcfg.semantic.scope.ConnectionScope;
import org.lokray.eqcfg.semantic.scope.ContextScope;
import org.lokray.eqcfg.semantic.scope.EquipmentScope;
import org.lokray.eqcfg.semantic.scope.ModuleScope;
import org.lokray.eqcfg.semantic.scope.Scope;
import org.lokray.eqcfg.semantic.scope.SignalScope;
import org.lokray.eqcfg.semantic.scope.TemplateScope;
import org.lokray.eqcfg.semantic.symbol.AckParameter;
import org.lokray.eqcfg.semantic.symbol.AddressParameter;
import org.lokray.eqcfg.semantic.symbol.ConnectionIdParameter;
import org.lokray.eqcfg.semantic.symbol.DescriptionParameter;
import org.lokray.eqcfg.semantic.symbol.DriverOption;
import org.lokray.eqcfg.semantic.symbol.EquipmentIdParameter;
import org.lokray.eqcfg.semantic.symbol.EquipmentLinkParameter;
import org.lokray.eqcfg.semantic.symbol.FormatParameter;
import org.lokray.eqcfg.semantic.symbol.FormulaParameter;
import org.lokray.eqcfg.semantic.symbol.LabelOption;
import org.lokray.eqcfg.semantic.symbol.Option;
import org.lokray.eqcfg.semantic.symbol.ParameterSymbol;
import org.lokray.eqcfg.semantic.symbol.PersistentParameter;
import org.lokray.eqcfg.semantic.symbol.RepresentationOption;
import org.lokray.eqcfg.semantic.symbol.SeverityOption;
import org.lokray.eqcfg.semantic.symbol.SignalIdParameter;
import org.lokray.eqcfg.semantic.symbol.SignalValueParameter;
import org.lokray.eqcfg.semantic.symbol.StatusOption;
import org.lokray.eqcfg.semantic.symbol.UnitsParameter;
import org.lokray.eqcfg.semantic.symbol.VariableSymbol;
import org.lokray.eqcfg.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finalizer that turns every replayed scope into an {@link Instance}.
 */
public class InstanceCollector implements Finalizer
{
	private final List<Instance> instances = new ArrayList<>();

	// State of the scope being replayed
	private String kind;
	private Scope scope;
	private Map<String, String> attributes;
	private List<ParameterEntry> parameters;
	private Map<String, Object> variables;
	private Map<String, Map<String, Object>> contexts;
	private String link;
	private List<OptionEntry> options;

	public List<Instance> getInstances()
	{
		return Collections.unmodifiableList(instances);
	}

	// --- Scopes ---

	@Override
	public void visitModule(ModuleScope scope)
	{
		begin("module", scope);
		collect(scope);
		finish();
	}

	@Override
	public void visitTemplate(TemplateScope scope)
	{
		begin("template", scope);
		for (ContextScope context : scope.getContexts())
		{
			context.accept(this);
		}
		collect(scope);
		finish();
	}

	@Override
	public void visitContext(ContextScope context)
	{
		Map<String, Object> values = new LinkedHashMap<>();
		for (VariableSymbol variable : context.getVariables())
		{
			values.put(variable.getName(), variable.getValue());
		}
		contexts.put(context.getName(), values);
	}

	@Override
	public void visitEquipment(EquipmentScope scope)
	{
		begin("equipment", scope);
		attributes.put("type", scope.getEquipmentType());
		collect(scope);
		finish();
	}

	@Override
	public void visitSignal(SignalScope scope)
	{
		begin("signal", scope);
		attributes.put("direction", scope.getDirection());
		attributes.put("signal_type", scope.getSignalType());
		collect(scope);
		if (scope.getLink() != null)
		{
			scope.getLink().accept(this);
		}
		finish();
	}

	@Override
	public void visitConnection(ConnectionScope scope)
	{
		begin("connection", scope);
		collect(scope);
		finish();
	}

	@Override
	public void visitConnectionLink(ConnectionLink link)
	{
		this.link = link.getTarget().getName();
	}

	@Override
	public void visitVariable(VariableSymbol variable)
	{
		variables.put(variable.getName(), variable.getValue());
	}

	// --- Parameters ---

	@Override
	public void visitSignalId(SignalIdParameter parameter)
	{
		addParameter("signal_id", parameter);
	}

	@Override
	public void visitEquipmentLink(EquipmentLinkParameter parameter)
	{
		addParameter("equipment_link", parameter);
	}

	@Override
	public void visitSignalValue(SignalValueParameter parameter)
	{
		addParameter("value", parameter);
	}

	@Override
	public void visitFormula(FormulaParameter parameter)
	{
		addParameter("formula", parameter);
	}

	@Override
	public void visitDescription(DescriptionParameter parameter)
	{
		addParameter("description", parameter);
	}

	@Override
	public void visitFormat(FormatParameter parameter)
	{
		addParameter("format", parameter);
	}

	@Override
	public void visitAck(AckParameter parameter)
	{
		addParameter("ack", parameter);
	}

	@Override
	public void visitPersistent(PersistentParameter parameter)
	{
		addParameter("persistent", parameter);
	}

	@Override
	public void visitUnits(UnitsParameter parameter)
	{
		addParameter("units", parameter);
	}

	@Override
	public void visitConnectionId(ConnectionIdParameter parameter)
	{
		addParameter("connection_id", parameter);
	}

	@Override
	public void visitAddress(AddressParameter parameter)
	{
		addParameter("address", parameter);
	}

	@Override
	public void visitEquipmentId(EquipmentIdParameter parameter)
	{
		addParameter("equipment_id", parameter);
	}

	// --- Options ---

	@Override
	public void visitStatusOption(StatusOption option)
	{
		addOption("status", option);
	}

	@Override
	public void visitRepresentationOption(RepresentationOption option)
	{
		addOption("representation", option);
	}

	@Override
	public void visitSeverityOption(SeverityOption option)
	{
		addOption("severity", option);
	}

	@Override
	public void visitLabelOption(LabelOption option)
	{
		addOption("label", option);
	}

	@Override
	public void visitDriverOption(DriverOption option)
	{
		addOption("driver", option);
	}

	// --- Helpers ---

	private void begin(String kind, Scope scope)
	{
		this.kind = kind;
		this.scope = scope;
		this.attributes = new LinkedHashMap<>();
		this.parameters = new ArrayList<>();
		this.variables = new LinkedHashMap<>();
		this.contexts = new LinkedHashMap<>();
		this.link = null;
	}

	/**
	 * Variables, bound context and parameters, in that order.
	 */
	private void collect(Scope scope)
	{
		for (VariableSymbol variable : scope.getVariables())
		{
			variable.accept(this);
		}
		if (scope.getContext() != null)
		{
			scope.getContext().accept(this);
		}
		for (ParameterSymbol parameter : scope.getParameters())
		{
			parameter.accept(this);
		}
	}

	private void addParameter(String parameterKind, ParameterSymbol parameter)
	{
		options = new ArrayList<>();
		for (Option option : parameter.getOptions())
		{
			option.accept(this);
		}
		parameters.add(new ParameterEntry(parameterKind, parameter.getName(), parameter.getType().getName(), parameter.resolveValue(), options));
	}

	private void addOption(String optionKind, Option option)
	{
		options.add(new OptionEntry(optionKind, option.getName(), option.getValue()));
	}

	private void finish()
	{
		Instance instance = new Instance(kind, scope.resolveFullName(), scope.getBaseName(), attributes, parameters, variables, contexts, link);
		instances.add(instance);
		Debug.logDebug("Collected " + instance);
	}
}

package org.lokray.eqcfg.emit;

import org.lokray.eqcfg.semantic.scope.ConnectionLink;
import org.lokray.eqcfg.semantic.scope.ConnectionScope;
import org.lokray.eqcfg.semantic.scope.ContextScope;
import org.lokray.eqcfg.semantic.scope.EquipmentScope;
import org.lokray.eqcfg.semantic.scope.ModuleScope;
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
import org.lokray.eqcfg.semantic.symbol.PersistentParameter;
import org.lokray.eqcfg.semantic.symbol.RepresentationOption;
import org.lokray.eqcfg.semantic.symbol.SeverityOption;
import org.lokray.eqcfg.semantic.symbol.SignalIdParameter;
import org.lokray.eqcfg.semantic.symbol.SignalValueParameter;
import org.lokray.eqcfg.semantic.symbol.StatusOption;
import org.lokray.eqcfg.semantic.symbol.UnitsParameter;
import org.lokray.eqcfg.semantic.symbol.VariableSymbol;

/**
 * Export surface of the compiler. Every replayed scope is handed to the matching visit
 * method; an implementation walks into the scope's variables, parameters, options and links
 * by calling {@code accept(this)} on them.
 * <p>
 * A scope listening to a context is visited once per admitted data row, with the context
 * holding that row's values.
 */
public interface Finalizer
{
	// Scopes
	void visitModule(ModuleScope scope);

	void visitTemplate(TemplateScope scope);

	void visitContext(ContextScope context);

	void visitEquipment(EquipmentScope scope);

	void visitSignal(SignalScope scope);

	void visitConnection(ConnectionScope scope);

	void visitConnectionLink(ConnectionLink link);

	void visitVariable(VariableSymbol variable);

	// Signal parameters
	void visitSignalId(SignalIdParameter parameter);

	void visitEquipmentLink(EquipmentLinkParameter parameter);

	void visitSignalValue(SignalValueParameter parameter);

	void visitFormula(FormulaParameter parameter);

	void visitDescription(DescriptionParameter parameter);

	void visitFormat(FormatParameter parameter);

	void visitAck(AckParameter parameter);

	void visitPersistent(PersistentParameter parameter);

	void visitUnits(UnitsParameter parameter);

	// Connection parameters
	void visitConnectionId(ConnectionIdParameter parameter);

	void visitAddress(AddressParameter parameter);

	// Equipment parameters
	void visitEquipmentId(EquipmentIdParameter parameter);

	// Options
	void visitStatusOption(StatusOption option);

	void visitRepresentationOption(RepresentationOption option);

	void visitSeverityOption(SeverityOption option);

	void visitLabelOption(LabelOption option);

	void visitDriverOption(DriverOption option);
}

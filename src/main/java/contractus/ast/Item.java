package contractus.ast;

public sealed interface Item extends Node permits StructDef, FunctionDef, ConstDef {
	String name();
}

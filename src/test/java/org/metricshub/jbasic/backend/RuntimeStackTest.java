package org.metricshub.jbasic.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class RuntimeStackTest {

	private static ForLoopFrame frame(char variable) {
		return new ForLoopFrame(variable, 10, 1, 100);
	}

	@Test
	public void testReturnLinesAreLifo() {
		RuntimeStack stack = new RuntimeStack();
		stack.pushReturn(20);
		stack.pushReturn(Executor.HALTED);
		stack.pushReturn(70);
		assertEquals(3, stack.returnDepth());
		assertEquals(Integer.valueOf(70), stack.popReturn());
		assertEquals(Integer.valueOf(Executor.HALTED), stack.popReturn());
		assertEquals(Integer.valueOf(20), stack.popReturn());
		assertNull(stack.popReturn());
	}

	@Test
	public void testFindLoopPopsInnerFrames() {
		RuntimeStack stack = new RuntimeStack();
		stack.pushLoop(frame('I'));
		stack.pushLoop(frame('J'));
		stack.pushLoop(frame('K'));
		assertEquals('I', stack.findLoop('I').getVariable());
		assertEquals(1, stack.loopDepth());
	}

	@Test
	public void testFindLoopWithoutVariableIsTheInnermost() {
		RuntimeStack stack = new RuntimeStack();
		stack.pushLoop(frame('I'));
		stack.pushLoop(frame('J'));
		assertEquals('J', stack.findLoop(null).getVariable());
		assertEquals(2, stack.loopDepth());
	}

	@Test
	public void testFindLoopWithoutMatchEmptiesTheStack() {
		RuntimeStack stack = new RuntimeStack();
		stack.pushLoop(frame('I'));
		stack.pushLoop(frame('J'));
		assertNull(stack.findLoop('X'));
		assertEquals(0, stack.loopDepth());
		assertNull(stack.findLoop(null));
	}

	@Test
	public void testDiscardLoop() {
		RuntimeStack stack = new RuntimeStack();
		stack.pushLoop(frame('A'));
		stack.pushLoop(frame('I'));
		stack.pushLoop(frame('J'));
		stack.discardLoop('X');
		assertEquals(3, stack.loopDepth());
		stack.discardLoop('I');
		assertEquals(1, stack.loopDepth());
		assertEquals('A', stack.findLoop(null).getVariable());
	}

	@Test
	public void testContinuesWith() {
		assertEquals(true, new ForLoopFrame('I', 3, 1, 10).continuesWith(3));
		assertEquals(false, new ForLoopFrame('I', 3, 1, 10).continuesWith(4));
		assertEquals(true, new ForLoopFrame('I', 1, -1, 10).continuesWith(1));
		assertEquals(false, new ForLoopFrame('I', 1, -1, 10).continuesWith(0));
		assertEquals(false, new ForLoopFrame('I', 5, 0, 10).continuesWith(1));
		assertEquals(false, new ForLoopFrame('I', Integer.MAX_VALUE, 1, 10).continuesWith(Integer.MAX_VALUE + 1L));
	}
}
